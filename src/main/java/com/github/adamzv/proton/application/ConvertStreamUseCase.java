package com.github.adamzv.proton.application;

import com.github.adamzv.proton.application.framing.MessageBoundarySplitter;
import com.github.adamzv.proton.domain.FrameToken;
import com.github.adamzv.proton.domain.FramingOptions;
import com.github.adamzv.proton.domain.ProblemException;
import com.github.adamzv.proton.domain.Problems;
import com.github.adamzv.proton.ports.SchemaDecoderPort;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ConvertStreamUseCase {

  private static final Logger log = LoggerFactory.getLogger(ConvertStreamUseCase.class);

  private static final byte[] NEWLINE = {'\n'};

  public ConversionResult execute(InputStream input, OutputStream output, FramingOptions framing,
                                  SchemaDecoderPort decoder) throws IOException {
    if (input == null || output == null) {
      throw Problems.invalidArgument("Input and output streams are required", Map.of());
    }
    if (framing == null || !framing.hasEndMarker()) {
      return convertWhole(input, output, decoder);
    }
    return convertFramed(input, output, framing, decoder);
  }

  private ConversionResult convertWhole(InputStream input, OutputStream output, SchemaDecoderPort decoder)
      throws IOException {
    byte[] payload = input.readAllBytes();
    String json = decoder.decode(payload);
    output.write(json.getBytes(StandardCharsets.UTF_8));
    output.write(NEWLINE);
    output.flush();
    return new ConversionResult(1, 1, 0, 0);
  }

  private ConversionResult convertFramed(InputStream input, OutputStream output, FramingOptions framing,
                                         SchemaDecoderPort decoder) throws IOException {
    MessageBoundarySplitter splitter = new MessageBoundarySplitter(input, framing);
    boolean separateLines = !framing.hasStartMarker();

    int framed = 0;
    int decoded = 0;
    int passedThrough = 0;
    int literal = 0;

    FrameToken token;
    while ((token = splitter.next()) != null) {
      if (!token.isFramed()) {
        literal++;
        output.write(token.bytes());
        continue;
      }

      framed++;
      try {
        output.write(decoder.decode(token.bytes()).getBytes(StandardCharsets.UTF_8));
        decoded++;
      } catch (ProblemException ex) {
        log.debug("frame_passthrough size={} reason={}", token.bytes().length, ex.getMessage());
        output.write(token.bytes());
        passedThrough++;
      }
      if (separateLines) {
        output.write(NEWLINE);
      }
    }
    output.flush();

    return new ConversionResult(framed, decoded, passedThrough, literal);
  }

  public record ConversionResult(int framed, int decoded, int passedThrough, int literal) {}
}
