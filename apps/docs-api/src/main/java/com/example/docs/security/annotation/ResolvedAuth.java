package com.example.docs.security.annotation;

import java.lang.annotation.*;

// Inject the gateway-authenticated AuthContext into a controller method parameter
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ResolvedAuth {
}
