package com.spanmatcher.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.spanmatcher.config.ConfigurationException;
import com.spanmatcher.config.Diagnostic;
import com.spanmatcher.config.MatcherConfig;
import com.spanmatcher.config.MatcherConfigLoader;
import com.spanmatcher.document.MatchSource;
import com.spanmatcher.document.Span;
import com.spanmatcher.document.TokenizedDocument;
import com.spanmatcher.pipeline.GenericMatcher;
import com.spanmatcher.pipeline.NormalizerStage;
import com.spanmatcher.pipeline.Pipeline;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "spanmatch",
    description = "词表/正则片段识别",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.MatchSubcommand.class,
        MainCommand.CheckSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    static final String MATCHER_NAME = "matcher";

    @Mixin
    private ConfigOptions globalOptions = new ConfigOptions();

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("词表/正则片段识别");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 配置相关选项，既可写在子命令之前，也可写在子命令之后；子命令上的值优先。
     */
    static class ConfigOptions {

        @Option(names = {"-c", "--config"}, description = "匹配器 JSON 配置文件")
        private Path configPath;

        @Option(names = {"--normalize"}, description = "在匹配前运行归一化阶段")
        private boolean normalize;
    }

    private Pipeline buildPipeline(ConfigOptions local, CommandSpec spec) throws IOException {
        Path configPath = local.configPath != null ? local.configPath : globalOptions.configPath;
        if (configPath == null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "缺少 --config 参数");
        }
        MatcherConfig config = new MatcherConfigLoader().load(configPath);

        Pipeline pipeline = new Pipeline();
        if (local.normalize || globalOptions.normalize) {
            pipeline.addStage(new NormalizerStage());
        }
        pipeline.addMatcher(MATCHER_NAME, config);
        return pipeline;
    }

    @Command(name = "match", description = "对文本运行匹配并输出片段")
    static class MatchSubcommand implements Callable<Integer> {

        @Option(names = {"-t", "--text"}, description = "待处理文本")
        private String text;

        @Option(names = {"-i", "--input"}, description = "待处理文本文件（UTF-8）")
        private Path input;

        @Option(names = {"-e", "--ents"}, split = ",",
            description = "匹配前已有的实体，格式 label:start:end（词元下标）")
        private List<String> entities;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @Mixin
        private ConfigOptions options = new ConfigOptions();

        @ParentCommand
        private MainCommand main;

        @Spec
        private CommandSpec spec;

        @Override
        public Integer call() {
            try {
                Pipeline pipeline = main.buildPipeline(options, spec);
                String content = readContent();

                long start = System.currentTimeMillis();
                TokenizedDocument document = pipeline.prepare(content, MATCHER_NAME);
                document.setEntities(parseEntities(document));
                pipeline.runFrom(document, MATCHER_NAME);
                long elapsed = System.currentTimeMillis() - start;

                MatchReport report = MatchReport.of(Instant.now(), elapsed, document.size(), document.entities());
                if ("json".equalsIgnoreCase(format)) {
                    printJsonResult(report);
                } else {
                    printTextResult(report);
                }
                return 0;
            } catch (CommandLine.ParameterException exception) {
                throw exception;
            } catch (ConfigurationException exception) {
                System.err.println("配置错误: " + exception.getMessage());
                return 1;
            } catch (Exception exception) {
                System.err.println("匹配失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }

        private String readContent() throws IOException {
            if (input != null) {
                return Files.readString(input, StandardCharsets.UTF_8);
            }
            if (text != null) {
                return text;
            }
            throw new CommandLine.ParameterException(spec.commandLine(), "需要 --text 或 --input");
        }

        private List<Span> parseEntities(TokenizedDocument document) {
            if (entities == null || entities.isEmpty()) {
                return List.of();
            }
            List<Span> parsed = new ArrayList<>(entities.size());
            for (String raw : entities) {
                String[] parts = raw.split(":");
                if (parts.length != 3) {
                    throw new CommandLine.ParameterException(spec.commandLine(), "实体格式应为 label:start:end: " + raw);
                }
                try {
                    parsed.add(new Span(document, Integer.parseInt(parts[1]), Integer.parseInt(parts[2]),
                        parts[0], MatchSource.EXACT));
                } catch (IllegalArgumentException exception) {
                    throw new CommandLine.ParameterException(spec.commandLine(),
                        "非法实体: " + raw + " (" + exception.getMessage() + ")");
                }
            }
            return parsed;
        }

        private void printTextResult(MatchReport report) {
            if (report.spans().isEmpty()) {
                System.out.println("未找到匹配片段");
                return;
            }
            for (MatchReport.SpanView span : report.spans()) {
                System.out.printf("%s\t[%d, %d)\t%s\t(%s)%n", span.label(), span.start(), span.end(), span.text(),
                    span.source().toLowerCase());
            }
            System.out.println("共 " + report.spans().size() + " 个片段，用时 " + report.elapsedMs() + "ms");
        }

        private void printJsonResult(MatchReport report) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
        }
    }

    @Command(name = "check", description = "校验配置并输出诊断信息")
    static class CheckSubcommand implements Callable<Integer> {

        @Mixin
        private ConfigOptions options = new ConfigOptions();

        @ParentCommand
        private MainCommand main;

        @Spec
        private CommandSpec spec;

        @Override
        public Integer call() {
            try {
                Pipeline pipeline = main.buildPipeline(options, spec);
                GenericMatcher matcher = findMatcher(pipeline);
                System.out.println("阶段: " + pipeline.pipeNames());
                System.out.println("属性: " + matcher.getState().getAttributes());
                System.out.println("词表模式: " + matcher.getState().getTermMatcher().patternCount()
                    + (matcher.getState().isFuzzy() ? " (fuzzy)" : " (exact)"));
                System.out.println("正则模式: " + matcher.getState().getRegexMatcher().patternCount());
                for (Diagnostic diagnostic : matcher.getDiagnostics()) {
                    System.out.println("警告: " + diagnostic);
                }
                return 0;
            } catch (ConfigurationException exception) {
                System.err.println("配置错误: " + exception.getMessage());
                return 1;
            } catch (IOException exception) {
                System.err.println("无法读取配置: " + exception.getMessage());
                return 1;
            }
        }

        private GenericMatcher findMatcher(Pipeline pipeline) {
            return pipeline.components().stream()
                .filter(GenericMatcher.class::isInstance)
                .map(GenericMatcher.class::cast)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("流水线中没有匹配阶段"));
        }
    }
}
