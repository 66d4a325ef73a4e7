package com.github.adamzv.proton.adapters.output;

import com.github.adamzv.proton.domain.DecodedResult;
import com.github.adamzv.proton.ports.MessageSinkPort;
import java.io.PrintStream;

public class FormattedPrinter implements MessageSinkPort {

  private final RecordFormat format;
  private final PrintStream out;
  private final PrintStream errOut;
  private final Object lock = new Object();

  public FormattedPrinter(RecordFormat format, PrintStream out, PrintStream errOut) {
    this.format = format;
    this.out = out;
    this.errOut = errOut;
  }

  @Override
  public void emit(DecodedResult result) {
    if (result instanceof DecodedResult.Decoded decoded) {
      String line = format.render(decoded);
      synchronized (lock) {
        out.println(line);
        out.flush();
      }
    } else if (result instanceof DecodedResult.DecodeError error) {
      String line = String.format("%s [%d] at offset %d: %s",
          error.topic(), error.partition(), error.offset(), describe(error.cause()));
      synchronized (lock) {
        errOut.println(line);
        errOut.flush();
      }
    }
  }

  private static String describe(Throwable cause) {
    if (cause == null) {
      return "decode failed";
    }
    return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
  }
}
