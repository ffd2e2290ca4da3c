package com.example.docs.config;

import com.example.docs.security.resolver.AuthContextArgumentResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import org.springframework.web.reactive.result.method.annotation.ArgumentResolverConfigurer;

/**
 * Registers {@link AuthContextArgumentResolver} so controllers can take
 * {@code @ResolvedAuth AuthContext} parameters.
 */
@Configuration
@RequiredArgsConstructor
public class WebFluxConfig implements WebFluxConfigurer {

    private final AuthContextArgumentResolver authContextArgumentResolver;

    @Override
    public void configureArgumentResolvers(ArgumentResolverConfigurer configurer) {
        configurer.addCustomResolver(authContextArgumentResolver);
    }
}
