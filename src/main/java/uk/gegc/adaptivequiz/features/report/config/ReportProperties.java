package uk.gegc.adaptivequiz.features.report.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Where rendered reports are written and the URL prefix they are served under.
 */
@Data
@Component
@ConfigurationProperties(prefix = "quiz.report")
public class ReportProperties {

    /**
     * Directory PDF reports are written to. Relative paths resolve against the working directory.
     */
    private String directory = "static/reports";

    /**
     * Prefix prepended to the file name in the report path returned to clients.
     */
    private String publicPathPrefix = "/reports/";
}
