package com.project.environmental.segmentation.config;

import com.project.environmental.segmentation.service.StorageService;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Serves annotated result images under /results/** straight from the storage output
 * directory, so the URLs returned by the API resolve regardless of the working directory.
 */
@Configuration
public class StaticResourceConfig implements WebMvcConfigurer {

    private final StorageService storageService;

    public StaticResourceConfig(StorageService storageService) {
        this.storageService = storageService;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        registry.addResourceHandler("/results/**")
                .addResourceLocations(storageService.outputDir().toUri().toString());
    }
}
