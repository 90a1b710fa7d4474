package uk.gegc.adaptivequiz.features.report.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.springframework.stereotype.Component;
import uk.gegc.adaptivequiz.features.report.application.ReportRenderer;
import uk.gegc.adaptivequiz.features.report.config.ReportProperties;
import uk.gegc.adaptivequiz.features.report.domain.model.ReportArtifact;
import uk.gegc.adaptivequiz.features.report.domain.model.SessionReport;
import uk.gegc.adaptivequiz.features.report.domain.model.SkillPerformance;
import uk.gegc.adaptivequiz.features.session.domain.model.AnswerRecord;
import uk.gegc.adaptivequiz.shared.exception.ReportGenerationException;

import java.awt.Color;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders a session report as a PDF in the reports directory.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PdfReportRenderer implements ReportRenderer {

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final DateTimeFormatter DISPLAY_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private static final float MARGIN = 50f;
    private static final float PAGE_WIDTH = PDRectangle.LETTER.getWidth();
    private static final float MAX_TEXT_WIDTH = PAGE_WIDTH - (2 * MARGIN);
    private static final float TITLE_FONT_SIZE = 18f;
    private static final float HEADING_FONT_SIZE = 14f;
    private static final float NORMAL_FONT_SIZE = 11f;
    private static final float SMALL_FONT_SIZE = 9f;
    private static final float LINE_SPACING = 1.2f;
    private static final float SECTION_SPACING = 16f;

    private static final float CHART_RADIUS = 50f;
    private static final float CHART_HEIGHT = 2 * CHART_RADIUS + 30f;
    private static final Color CORRECT_COLOR = new Color(0x00, 0xB8, 0x94);
    private static final Color INCORRECT_COLOR = new Color(0xD6, 0x30, 0x31);
    private static final Color NO_DATA_COLOR = new Color(0xB2, 0xBE, 0xC3);

    private final ReportProperties reportProperties;
    private final Clock clock;

    @Override
    public ReportArtifact render(SessionReport report) {
        String filename = buildFilename(report.username(), report.sessionId());
        try {
            Path directory = Paths.get(reportProperties.getDirectory()).toAbsolutePath();
            Files.createDirectories(directory);
            Path target = directory.resolve(filename);

            try (PDDocument document = new PDDocument()) {
                PDPageContext context = new PDPageContext(document);
                context.startNewPage();

                renderHeader(context, report);
                renderInsights(context, report);
                renderSkills(context, report);
                renderQuestions(context, report);

                // Ensure the last page's content stream is closed before saving
                context.close();
                document.save(target.toFile());
            }

            log.debug("Rendered report {} ({} questions)", target, report.history().size());
            return new ReportArtifact(filename, target);
        } catch (IOException | RuntimeException e) {
            throw new ReportGenerationException("Failed to render PDF report " + filename, e);
        }
    }

    /**
     * Builds {@code <username>_quiz_report_<timestamp>_<sessionId>.pdf}. The
     * session id keeps names unique per session and hard to guess.
     */
    String buildFilename(String username, String sessionId) {
        String usernameSafe = username == null ? "" : username.replaceAll("[^\\w\\s-]", "").trim().replaceAll("\\s+", "_");
        if (usernameSafe.isEmpty()) {
            usernameSafe = "Student";
        }
        String sessionSafe = sessionId == null ? "" : sessionId.replaceAll("[^A-Za-z0-9-]", "");
        if (sessionSafe.isEmpty()) {
            throw new IllegalArgumentException("Session id is required for the report filename");
        }
        return usernameSafe + "_quiz_report_" + LocalDateTime.now(clock).format(FILE_TIMESTAMP)
                + "_" + sessionSafe + ".pdf";
    }

    private void renderHeader(PDPageContext context, SessionReport report) throws IOException {
        context.writeText("Math Quiz Performance Report", PDType1Font.HELVETICA_BOLD, TITLE_FONT_SIZE);
        context.y -= 10;

        context.writeText("Student: " + report.username(), PDType1Font.HELVETICA, NORMAL_FONT_SIZE);
        context.writeText("Topic: " + report.topic().getDisplayName(), PDType1Font.HELVETICA, NORMAL_FONT_SIZE);
        context.writeText("Date: " + LocalDateTime.ofInstant(report.generatedAt(), clock.getZone()).format(DISPLAY_TIMESTAMP),
                PDType1Font.HELVETICA, NORMAL_FONT_SIZE);
        context.writeText("Questions answered: " + report.totalAnswered()
                        + " | Correct: " + report.correct()
                        + " | Incorrect: " + report.incorrect(),
                PDType1Font.HELVETICA, NORMAL_FONT_SIZE);
        context.writeText(String.format(Locale.ROOT, "Final score: %.1f%% (final level %d)",
                report.percentageScore(), report.finalLevel()), PDType1Font.HELVETICA_BOLD, NORMAL_FONT_SIZE);
        context.y -= SECTION_SPACING;
        renderScoreChart(context, report);
    }

    private void renderScoreChart(PDPageContext context, SessionReport report) throws IOException {
        context.ensureSpace(CHART_HEIGHT + HEADING_FONT_SIZE * LINE_SPACING);
        boolean noData = report.correct() + report.incorrect() == 0;
        context.writeText(noData ? "Score Summary (No Data)" : "Score Summary", PDType1Font.HELVETICA_BOLD, HEADING_FONT_SIZE);

        float centerX = MARGIN + CHART_RADIUS + 5;
        float centerY = context.y - CHART_RADIUS - 5;
        float legendX = centerX + CHART_RADIUS + 30;
        if (noData) {
            context.fillSlice(centerX, centerY, CHART_RADIUS, 0, 360, NO_DATA_COLOR);
            context.writeTextAt("No Data", PDType1Font.HELVETICA_BOLD, NORMAL_FONT_SIZE, legendX, centerY);
        } else {
            float correctSweep = 360f * report.correct() / (report.correct() + report.incorrect());
            // Slices start at 12 o'clock and run clockwise, correct first
            context.fillSlice(centerX, centerY, CHART_RADIUS, 90, -correctSweep, CORRECT_COLOR);
            context.fillSlice(centerX, centerY, CHART_RADIUS, 90 - correctSweep, -(360 - correctSweep), INCORRECT_COLOR);
            context.fillSquare(legendX, centerY + 8, 8, CORRECT_COLOR);
            context.writeTextAt("Correct answers: " + report.correct(), PDType1Font.HELVETICA, NORMAL_FONT_SIZE,
                    legendX + 14, centerY + 8);
            context.fillSquare(legendX, centerY - 12, 8, INCORRECT_COLOR);
            context.writeTextAt("Incorrect answers: " + report.incorrect(), PDType1Font.HELVETICA, NORMAL_FONT_SIZE,
                    legendX + 14, centerY - 12);
        }
        context.y -= CHART_HEIGHT;
    }

    private void renderInsights(PDPageContext context, SessionReport report) throws IOException {
        context.ensureSpace(60);
        context.writeText("AI Insights", PDType1Font.HELVETICA_BOLD, HEADING_FONT_SIZE);
        context.y -= 4;
        context.writeText("Summary", PDType1Font.HELVETICA_BOLD, NORMAL_FONT_SIZE);
        context.writeParagraphs(report.aiSummary(), PDType1Font.HELVETICA, NORMAL_FONT_SIZE);
        context.y -= 6;
        context.writeText("Recommendations", PDType1Font.HELVETICA_BOLD, NORMAL_FONT_SIZE);
        context.writeParagraphs(report.aiRecommendations(), PDType1Font.HELVETICA, NORMAL_FONT_SIZE);
        context.y -= SECTION_SPACING;
    }

    private void renderSkills(PDPageContext context, SessionReport report) throws IOException {
        context.ensureSpace(60);
        context.writeText("Performance by Skill", PDType1Font.HELVETICA_BOLD, HEADING_FONT_SIZE);
        context.y -= 4;
        if (report.skills().isEmpty()) {
            context.writeText("No questions were answered.", PDType1Font.HELVETICA_OBLIQUE, NORMAL_FONT_SIZE);
        }
        for (SkillPerformance skill : report.skills()) {
            context.writeText(String.format(Locale.ROOT, "- %s: %d out of %d correct (%.1f%%)",
                    skill.skill(), skill.correct(), skill.total(), skill.percentage()),
                    PDType1Font.HELVETICA, NORMAL_FONT_SIZE);
        }
        context.y -= SECTION_SPACING;
    }

    private void renderQuestions(PDPageContext context, SessionReport report) throws IOException {
        if (report.history().isEmpty()) {
            return;
        }
        context.ensureSpace(80);
        context.writeText("Question Details", PDType1Font.HELVETICA_BOLD, HEADING_FONT_SIZE);
        context.y -= 4;

        int number = 1;
        for (AnswerRecord record : report.history()) {
            context.ensureSpace(90);
            context.writeText("Q" + number++ + " [" + record.skill() + ", level " + record.levelAtTime() + "]: "
                    + record.question(), PDType1Font.HELVETICA_BOLD, NORMAL_FONT_SIZE);
            context.writeText("Your answer: " + record.userAnswer(), PDType1Font.HELVETICA, NORMAL_FONT_SIZE);
            context.writeText("Correct answer: " + record.correctAnswer(), PDType1Font.HELVETICA, NORMAL_FONT_SIZE);
            context.writeText("Result: " + (record.correct() ? "Correct" : "Incorrect")
                    + (record.judgmentText() != null ? " - " + record.judgmentText() : ""),
                    PDType1Font.HELVETICA, NORMAL_FONT_SIZE);
            context.writeParagraphs("Explanation: " + record.explanationText(), PDType1Font.HELVETICA, SMALL_FONT_SIZE);
            context.y -= 10;
        }
    }

    /**
     * Replaces characters the standard Type 1 fonts cannot encode.
     */
    static String sanitize(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder sanitized = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\u2212', '\u2013', '\u2014' -> sanitized.append('-');
                case '‘', '’' -> sanitized.append('\'');
                case '“', '”' -> sanitized.append('"');
                case '\t' -> sanitized.append(' ');
                default -> {
                    if ((c >= 0x20 && c <= 0x7E) || (c >= 0xA0 && c <= 0xFF)) {
                        sanitized.append(c);
                    } else {
                        sanitized.append('?');
                    }
                }
            }
        }
        return sanitized.toString();
    }

    private static class PDPageContext {
        private final PDDocument document;
        private PDPageContentStream contentStream;
        private float y;
        private final float pageHeight = PDRectangle.LETTER.getHeight();

        PDPageContext(PDDocument document) {
            this.document = document;
        }

        void startNewPage() throws IOException {
            if (contentStream != null) {
                contentStream.close();
            }
            PDPage page = new PDPage(PDRectangle.LETTER);
            document.addPage(page);
            contentStream = new PDPageContentStream(document, page);
            y = pageHeight - MARGIN;
        }

        void ensureSpace(float requiredSpace) throws IOException {
            if (contentStream == null || y < MARGIN + requiredSpace) {
                startNewPage();
            }
        }

        void writeText(String text, PDFont font, float fontSize) throws IOException {
            writeWrappedText(text, font, fontSize);
        }

        /**
         * Writes each line of a multi-line text as its own wrapped paragraph.
         */
        void writeParagraphs(String text, PDFont font, float fontSize) throws IOException {
            if (text == null) {
                return;
            }
            for (String paragraph : text.split("\\r?\\n")) {
                writeWrappedText(paragraph, font, fontSize);
            }
        }

        void writeWrappedText(String text, PDFont font, float fontSize) throws IOException {
            String clean = sanitize(text);
            if (clean.isBlank()) {
                return;
            }

            String[] words = clean.trim().split("\\s+");
            StringBuilder line = new StringBuilder();
            for (String word : words) {
                String testLine = line.length() == 0 ? word : line + " " + word;
                float width = font.getStringWidth(testLine) / 1000 * fontSize;
                if (width > MAX_TEXT_WIDTH && line.length() > 0) {
                    writeSingleLine(line.toString(), font, fontSize);
                    line = new StringBuilder(word);
                } else {
                    line = new StringBuilder(testLine);
                }
            }
            if (line.length() > 0) {
                writeSingleLine(line.toString(), font, fontSize);
            }
        }

        private void writeSingleLine(String text, PDFont font, float fontSize) throws IOException {
            ensureSpace(fontSize * LINE_SPACING);
            contentStream.beginText();
            contentStream.setFont(font, fontSize);
            contentStream.newLineAtOffset(MARGIN, y);
            contentStream.showText(text);
            contentStream.endText();
            y -= fontSize * LINE_SPACING;
        }

        void writeTextAt(String text, PDFont font, float fontSize, float x, float baseline) throws IOException {
            contentStream.beginText();
            contentStream.setFont(font, fontSize);
            contentStream.newLineAtOffset(x, baseline);
            contentStream.showText(sanitize(text));
            contentStream.endText();
        }

        void fillSquare(float x, float baseline, float size, Color color) throws IOException {
            contentStream.setNonStrokingColor(color);
            contentStream.addRect(x, baseline, size, size);
            contentStream.fill();
            contentStream.setNonStrokingColor(Color.BLACK);
        }

        /**
         * Fills a pie slice from {@code startDegrees} sweeping {@code sweepDegrees}
         * (negative is clockwise). Arcs are approximated with one cubic Bezier
         * curve per quarter turn or less.
         */
        void fillSlice(float cx, float cy, float radius, float startDegrees, float sweepDegrees, Color color)
                throws IOException {
            if (Math.abs(sweepDegrees) < 0.01f) {
                return;
            }
            boolean fullCircle = Math.abs(sweepDegrees) >= 359.99f;
            contentStream.setNonStrokingColor(color);
            double start = Math.toRadians(startDegrees);
            if (fullCircle) {
                contentStream.moveTo((float) (cx + radius * Math.cos(start)), (float) (cy + radius * Math.sin(start)));
            } else {
                contentStream.moveTo(cx, cy);
                contentStream.lineTo((float) (cx + radius * Math.cos(start)), (float) (cy + radius * Math.sin(start)));
            }

            int segments = (int) Math.ceil(Math.abs(sweepDegrees) / 90f);
            double step = Math.toRadians(sweepDegrees) / segments;
            double k = 4.0 / 3.0 * Math.tan(step / 4);
            double angle = start;
            for (int i = 0; i < segments; i++) {
                double next = angle + step;
                double x0 = cx + radius * Math.cos(angle);
                double y0 = cy + radius * Math.sin(angle);
                double x3 = cx + radius * Math.cos(next);
                double y3 = cy + radius * Math.sin(next);
                contentStream.curveTo(
                        (float) (x0 - k * radius * Math.sin(angle)), (float) (y0 + k * radius * Math.cos(angle)),
                        (float) (x3 + k * radius * Math.sin(next)), (float) (y3 - k * radius * Math.cos(next)),
                        (float) x3, (float) y3);
                angle = next;
            }
            contentStream.closePath();
            contentStream.fill();
            contentStream.setNonStrokingColor(Color.BLACK);
        }

        void close() throws IOException {
            if (contentStream != null) {
                contentStream.close();
                contentStream = null;
            }
        }
    }
}
