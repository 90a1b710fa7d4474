package uk.gegc.adaptivequiz.features.report.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Paths;

/**
 * Serves rendered report files from the reports directory.
 */
@Configuration
@RequiredArgsConstructor
public class ReportResourceConfig implements WebMvcConfigurer {

    private final ReportProperties reportProperties;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String prefix = reportProperties.getPublicPathPrefix();
        String pattern = (prefix.endsWith("/") ? prefix : prefix + "/") + "**";
        String location = Paths.get(reportProperties.getDirectory()).toAbsolutePath().toUri().toString();
        registry.addResourceHandler(pattern)
                .addResourceLocations(location.endsWith("/") ? location : location + "/");
    }
}
