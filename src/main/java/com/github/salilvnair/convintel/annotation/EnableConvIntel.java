package com.github.salilvnair.convintel.annotation;

import com.github.salilvnair.convintel.config.ConvIntelAutoConfiguration;
import org.springframework.context.annotation.Import;
import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(ConvIntelAutoConfiguration.class)
public @interface EnableConvIntel {
}
