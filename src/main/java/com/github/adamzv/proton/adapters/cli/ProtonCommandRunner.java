package com.github.adamzv.proton.adapters.cli;

import com.github.adamzv.proton.adapters.output.FormattedPrinter;
import com.github.adamzv.proton.adapters.output.RecordFormat;
import com.github.adamzv.proton.adapters.protobuf.DescriptorSetLoader;
import com.github.adamzv.proton.adapters.protobuf.ProtobufSchemaDecoder;
import com.github.adamzv.proton.application.ConsumeTopicUseCase;
import com.github.adamzv.proton.application.ConsumptionMetrics;
import com.github.adamzv.proton.application.ConsumptionRun;
import com.github.adamzv.proton.application.ConvertStreamUseCase;
import com.github.adamzv.proton.domain.ConsumeSettings;
import com.github.adamzv.proton.domain.ProblemException;
import com.github.adamzv.proton.domain.Problems;
import com.github.adamzv.proton.ports.SchemaDecoderPort;
import com.github.adamzv.proton.support.ConsoleStreams;
import com.github.adamzv.proton.support.ConsumeProperties;
import com.github.adamzv.proton.support.FramingProperties;
import com.github.adamzv.proton.support.SchemaProperties;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

@Component
public class ProtonCommandRunner implements ApplicationRunner, ExitCodeGenerator, DisposableBean {

  private static final Logger log = LoggerFactory.getLogger(ProtonCommandRunner.class);

  static final String CONSUME = "consume";
  static final String JSON = "json";

  private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

  private static final String USAGE = """
      usage: proton <command> [--property=value ...]

      commands:
        consume   consume a topic and print every decoded message
                  --consume.topic, --consume.offsets=s@<millis>,e@<millis>, --consume.key=<regexp>,
                  --consume.format=<format>, --consume.verbose=true
        json      convert a protobuf file, or stdin, to JSON
                  [file] --framing.end-marker=<marker> --framing.start-marker=<marker>

      common:
        --kafka.bootstrap-servers, --schema.file=<descriptor set>, --schema.package-name,
        --schema.type, --schema.indent
      """;

  private final ObjectProvider<ConsumeTopicUseCase> consumeTopicUseCase;
  private final ConvertStreamUseCase convertStreamUseCase;
  private final DescriptorSetLoader descriptorSetLoader;
  private final ConsumeProperties consumeProperties;
  private final SchemaProperties schemaProperties;
  private final FramingProperties framingProperties;
  private final ConsoleStreams console;
  private final InterruptTrap interruptTrap;

  private volatile ConsumptionRun activeRun;
  private volatile int exitCode;

  public ProtonCommandRunner(
      ObjectProvider<ConsumeTopicUseCase> consumeTopicUseCase,
      ConvertStreamUseCase convertStreamUseCase,
      DescriptorSetLoader descriptorSetLoader,
      ConsumeProperties consumeProperties,
      SchemaProperties schemaProperties,
      FramingProperties framingProperties,
      ConsoleStreams console,
      InterruptTrap interruptTrap) {
    this.consumeTopicUseCase = consumeTopicUseCase;
    this.convertStreamUseCase = convertStreamUseCase;
    this.descriptorSetLoader = descriptorSetLoader;
    this.consumeProperties = consumeProperties;
    this.schemaProperties = schemaProperties;
    this.framingProperties = framingProperties;
    this.console = console;
    this.interruptTrap = interruptTrap;
  }

  @Override
  public void run(ApplicationArguments args) {
    List<String> positional = args.getNonOptionArgs();
    String command = positional.isEmpty() ? "" : positional.get(0);
    try {
      exitCode = switch (command) {
        case CONSUME -> consume();
        case JSON -> convert(positional.subList(1, positional.size()));
        default -> usage(command);
      };
    } catch (ProblemException ex) {
      report(ex);
      exitCode = 1;
    } catch (IOException ex) {
      log.error("io_failure command={} message={}", command, ex.getMessage());
      exitCode = 1;
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  @Override
  public void destroy() throws InterruptedException {
    ConsumptionRun run = activeRun;
    if (run != null && !run.isDone()) {
      log.debug("consume_interrupted cancelling active run");
      run.cancel();
      run.awaitTermination(SHUTDOWN_GRACE);
    }
  }

  private int consume() {
    OffsetArguments.Bounds bounds = OffsetArguments.parse(consumeProperties.offsets());
    ConsumeSettings settings = new ConsumeSettings(
        consumeProperties.topic(),
        bounds.start(),
        bounds.end(),
        consumeProperties.key(),
        consumeProperties.verbose()
    );
    RecordFormat format = RecordFormat.parse(consumeProperties.format(), ZoneId.systemDefault());
    SchemaDecoderPort decoder = decoder();

    ConsumeTopicUseCase useCase = consumeTopicUseCase.getObject();
    ConsumptionRun run = useCase.start(settings, decoder, new FormattedPrinter(format, console.out(), console.err()));
    activeRun = run;

    List<ProblemException> errors;
    try (InterruptTrap.Registration ignored = interruptTrap.install(() -> {
      log.debug("consume_interrupted cancelling active run");
      run.cancel();
    })) {
      errors = run.awaitCompletion(this::report);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      run.cancel();
      return 0;
    }

    if (settings.verbose()) {
      ConsumptionMetrics.Summary summary = useCase.summary(settings.topic());
      log.info("# Consumed {} messages: {} printed, {} filtered by key, {} failed to decode",
          summary.consumed(), summary.decoded(), summary.filtered(), summary.decodeErrors());
    }
    return errors.isEmpty() ? 0 : 1;
  }

  private int convert(List<String> files) throws IOException {
    SchemaDecoderPort decoder = decoder();
    String file = !files.isEmpty() ? files.get(0) : framingProperties.input();

    if (file == null || file.isBlank()) {
      convertInterruptibly(console.in(), decoder);
      return 0;
    }

    Path path = Path.of(file).toAbsolutePath().normalize();
    if (!Files.isRegularFile(path)) {
      throw Problems.invalidArgument("input file does not exist", Map.of("file", file));
    }
    try (InputStream in = Files.newInputStream(path)) {
      convertInterruptibly(in, decoder);
    }
    return 0;
  }

  // Reads blocked on a pipe cannot be cancelled; an interrupt exits with status 0.
  private void convertInterruptibly(InputStream in, SchemaDecoderPort decoder) throws IOException {
    try (InterruptTrap.Registration ignored = interruptTrap.install(() -> {
      log.debug("json_interrupted exiting");
      console.out().flush();
      interruptTrap.exitNormally();
    })) {
      convertStreamUseCase.execute(in, console.out(), framingProperties.toDomain(), decoder);
    }
  }

  private SchemaDecoderPort decoder() {
    return new ProtobufSchemaDecoder(
        descriptorSetLoader.load(schemaProperties.file(), schemaProperties.packageName(), schemaProperties.type()),
        schemaProperties.indent()
    );
  }

  private int usage(String command) {
    if (!command.isEmpty()) {
      console.err().println("unknown command: " + command);
    }
    console.err().print(USAGE);
    console.err().flush();
    return command.isEmpty() ? 0 : 1;
  }

  private void report(ProblemException ex) {
    log.error("{} code={} details={}", ex.getMessage(), ex.code(),
        ex.problem() != null ? ex.problem().details() : Map.of());
  }
}
