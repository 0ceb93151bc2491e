package com.spanmatcher.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.spanmatcher.document.DocumentFactory;
import com.spanmatcher.document.MatchSource;
import com.spanmatcher.document.Span;
import com.spanmatcher.document.TokenizedDocument;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.lang.reflect.Method;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;
import picocli.CommandLine.ParseResult;

class MainCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testCallWithoutSubcommand() {
        MainCommand command = new MainCommand();
        assertEquals(0, command.call());
    }

    @Test
    void testHelpOptionReturnsZero() {
        int exitCode = new CommandLine(new MainCommand()).execute("--help");
        assertEquals(0, exitCode);
    }

    @Test
    void testParseGlobalOptionsAndSubcommand() {
        CommandLine commandLine = new CommandLine(new MainCommand());
        ParseResult parseResult = commandLine.parseArgs("--config", "cfg.json", "--normalize", "match", "-t", "x");

        assertNotNull(parseResult.subcommand());
        assertEquals("match", parseResult.subcommand().commandSpec().name());
    }

    @Test
    void testMatchTextOutput() throws Exception {
        Path config = writeConfig("{\"terms\": {\"drug\": \"aspirin\"}, \"regex\": {\"dose\": \"\\\\d+mg\"}}");

        String output = captureOut(() -> new CommandLine(new MainCommand())
            .execute("--config", config.toString(), "match", "--text", "Take aspirin 50mg now"));

        assertTrue(output.contains("drug\t[1, 2)\taspirin\t(exact)"));
        assertTrue(output.contains("dose\t[2, 3)\t50mg\t(regex)"));
    }

    @Test
    void testMatchJsonOutputFromFile() throws Exception {
        Path config = writeConfig("{\"terms\": {\"drug\": \"aspirin\"}}");
        Path input = tempDir.resolve("note.txt");
        Files.writeString(input, "Patient takes aspirin daily");

        String output = captureOut(() -> new CommandLine(new MainCommand())
            .execute("-c", config.toString(), "match", "-i", input.toString(), "-f", "json"));

        assertTrue(output.contains("\"spans\""));
        assertTrue(output.contains("\"label\" : \"drug\""));
        assertTrue(output.contains("\"processedAt\""));
    }

    @Test
    void testMatchWithSeedEntities() throws Exception {
        Path config = writeConfig("{\"terms\": {\"drug\": \"aspirin\"}, \"on_ents_only\": true}");

        String output = captureOut(() -> new CommandLine(new MainCommand())
            .execute("-c", config.toString(), "match", "-t", "aspirin here. Patient takes aspirin.",
                "--ents", "person:3:4"));

        assertTrue(output.contains("drug\t[5, 6)"));
        assertFalse(output.contains("[0, 1)"));
    }

    @Test
    void testMatchWithoutConfigIsUsageError() {
        int exitCode = new CommandLine(new MainCommand()).execute("match", "--text", "aspirin");
        assertEquals(2, exitCode);
    }

    @Test
    void testCheckWithoutConfigIsUsageError() {
        int exitCode = new CommandLine(new MainCommand()).execute("check");
        assertEquals(2, exitCode);
    }

    @Test
    void testMatchWithoutTextIsUsageError() throws Exception {
        Path config = writeConfig("{\"terms\": {\"drug\": \"aspirin\"}}");

        assertEquals(2, new CommandLine(new MainCommand()).execute("-c", config.toString(), "match"));
        assertEquals(2, new CommandLine(new MainCommand())
            .execute("-c", config.toString(), "match", "-t", "aspirin", "--ents", "drug:0"));
    }

    @Test
    @DisplayName("配置选项写在子命令之后同样生效")
    void testConfigOptionAfterSubcommand() throws Exception {
        Path config = writeConfig("{\"terms\": {\"drug\": \"aspirin\"}, \"attr\": \"NORM\"}");

        String matchOutput = captureOut(() -> new CommandLine(new MainCommand())
            .execute("match", "--config", config.toString(), "--normalize", "--text", "Take ASPIRIN"));
        String checkOutput = captureOut(() -> new CommandLine(new MainCommand())
            .execute("check", "-c", config.toString(), "--normalize"));

        assertTrue(matchOutput.contains("drug\t[1, 2)\tASPIRIN\t(exact)"));
        assertTrue(checkOutput.contains("[normalizer, matcher]"));
    }

    @Test
    void testMalformedConfigFileFails() throws Exception {
        Path config = writeConfig("{\"terms\": ");

        assertEquals(1, new CommandLine(new MainCommand()).execute("-c", config.toString(), "match", "-t", "x"));
        assertEquals(1, new CommandLine(new MainCommand()).execute("-c", config.toString(), "check"));
    }

    @Test
    void testMatchWithInvalidAttributeFails() throws Exception {
        Path config = writeConfig("{\"regex\": {\"dose\": \"\\\\d+mg\"}, \"attr\": {\"dose\": \"LEMMA\"}}");

        int exitCode = new CommandLine(new MainCommand()).execute("-c", config.toString(), "match", "-t", "x");
        assertEquals(1, exitCode);
    }

    @Test
    void testCheckPrintsDiagnostics() throws Exception {
        Path config = writeConfig("{\"terms\": {\"drug\": \"aspirin\"}, \"attr\": \"NORM\", \"fuzzy\": true}");

        String output = captureOut(() -> new CommandLine(new MainCommand())
            .execute("-c", config.toString(), "check"));

        assertTrue(output.contains("(fuzzy)"));
        assertTrue(output.contains("MISSING_NORMALIZER"));
        assertTrue(output.contains("FUZZY_PERFORMANCE"));
    }

    @Test
    void testCheckWithNormalizer() throws Exception {
        Path config = writeConfig("{\"terms\": {\"drug\": \"aspirin\"}, \"attr\": \"NORM\"}");

        String output = captureOut(() -> new CommandLine(new MainCommand())
            .execute("-c", config.toString(), "--normalize", "check"));

        assertTrue(output.contains("[normalizer, matcher]"));
        assertFalse(output.contains("MISSING_NORMALIZER"));
    }

    @Test
    void testPrintTextResultWhenNoSpans() throws Exception {
        MainCommand.MatchSubcommand matchSubcommand = new MainCommand.MatchSubcommand();
        MatchReport emptyReport = new MatchReport(Instant.now(), 1L, 0, List.of());
        Method printTextResultMethod = MainCommand.MatchSubcommand.class.getDeclaredMethod("printTextResult", MatchReport.class);
        printTextResultMethod.setAccessible(true);

        String output = captureOut(() -> {
            printTextResultMethod.invoke(matchSubcommand, emptyReport);
            return 0;
        });

        assertTrue(output.contains("未找到匹配片段"));
    }

    @Test
    void testReportFromSpans() {
        TokenizedDocument document = new DocumentFactory().create("Take 50mg now");
        Span span = new Span(document, 1, 2, "dose", MatchSource.REGEX);

        MatchReport report = MatchReport.of(Instant.EPOCH, 3L, document.size(), List.of(span));

        assertEquals(List.of(new MatchReport.SpanView("dose", 1, 2, "50mg", "REGEX")), report.spans());
        assertEquals(3, report.tokenCount());
    }

    private Path writeConfig(String json) throws Exception {
        Path config = tempDir.resolve("matcher.json");
        Files.writeString(config, json);
        return config;
    }

    private static String captureOut(Callable<?> action) throws Exception {
        ByteArrayOutputStream outputBuffer = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        try {
            System.setOut(new PrintStream(outputBuffer, true, "UTF-8"));
            action.call();
        } finally {
            System.setOut(originalOut);
        }
        return outputBuffer.toString("UTF-8");
    }
}
