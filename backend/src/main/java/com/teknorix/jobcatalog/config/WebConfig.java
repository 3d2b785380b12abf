package com.teknorix.jobcatalog.config;

import com.teknorix.jobcatalog.auth.BearerTokenInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Registers the bearer token check for every API route. The interceptor itself decides,
 * per handler, whether a token is required.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {
    private final BearerTokenInterceptor bearerTokenInterceptor;

    public WebConfig(BearerTokenInterceptor bearerTokenInterceptor) {
        this.bearerTokenInterceptor = bearerTokenInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(bearerTokenInterceptor).addPathPatterns("/api/**");
    }
}
