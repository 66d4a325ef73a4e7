package com.github.adamzv.proton.support;

import java.io.InputStream;
import java.io.PrintStream;

public record ConsoleStreams(
    InputStream in,
    PrintStream out,
    PrintStream err
) {

  public static ConsoleStreams system() {
    return new ConsoleStreams(System.in, System.out, System.err);
  }
}
