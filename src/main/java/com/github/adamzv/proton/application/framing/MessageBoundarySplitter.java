package com.github.adamzv.proton.application.framing;

import com.github.adamzv.proton.domain.FrameToken;
import com.github.adamzv.proton.domain.FramingOptions;
import com.github.adamzv.proton.domain.Problems;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Map;

/**
 * Forward-only cursor that splits a byte stream into {@link FrameToken}s.
 *
 * <p>With only an end marker every token is {@link FrameToken.Kind#FRAMED} and the marker separates
 * consecutive messages. With both markers, bytes between a start and the following end marker are
 * framed and everything else passes through as {@link FrameToken.Kind#LITERAL}. Without an end marker
 * the whole input is a single literal token.
 *
 * <p>Markers are never part of a token, except when the stream ends inside a framed region: the
 * unterminated remainder, start marker included, is then returned as a literal token. Empty tokens are
 * skipped. Not thread-safe.
 */
public final class MessageBoundarySplitter {

  public enum State {
    SCANNING_FOR_START,
    SCANNING_FOR_END,
    DRAINING,
    DONE
  }

  private enum Mode {
    WHOLE_INPUT,
    END_MARKER_ONLY,
    START_AND_END
  }

  private static final int INITIAL_CAPACITY = 4096;

  private final InputStream input;
  private final byte[] startMarker;
  private final byte[] endMarker;
  private final int maxTokenSize;
  private final Mode mode;

  private byte[] buffer;
  private int position;
  private int limit;
  private int scanFrom;
  private boolean endOfStream;
  private State state;

  public MessageBoundarySplitter(InputStream input, FramingOptions options) {
    this.input = input;
    this.startMarker = options.startMarker().clone();
    this.endMarker = options.endMarker().clone();
    this.maxTokenSize = options.maxTokenSize();
    this.buffer = new byte[Math.min(INITIAL_CAPACITY, maxTokenSize)];

    if (!options.hasEndMarker()) {
      this.mode = Mode.WHOLE_INPUT;
      this.state = State.DRAINING;
    } else if (!options.hasStartMarker()) {
      this.mode = Mode.END_MARKER_ONLY;
      this.state = State.SCANNING_FOR_END;
    } else {
      this.mode = Mode.START_AND_END;
      this.state = State.SCANNING_FOR_START;
    }
  }

  /**
   * Returns the next token, reading from the underlying stream as needed.
   *
   * @return the next token or {@code null} once the stream is exhausted
   */
  public FrameToken next() throws IOException {
    while (state != State.DONE) {
      FrameToken token = switch (state) {
        case SCANNING_FOR_START -> scanForStart();
        case SCANNING_FOR_END -> scanForEnd();
        case DRAINING -> drain();
        case DONE -> null;
      };
      if (token != null) {
        return token;
      }
    }
    return null;
  }

  public State state() {
    return state;
  }

  private FrameToken scanForStart() throws IOException {
    int found = indexOf(startMarker, Math.max(position, scanFrom));
    if (found < 0) {
      if (endOfStream) {
        state = State.DRAINING;
      } else {
        scanFrom = Math.max(position, limit - startMarker.length + 1);
        fill();
      }
      return null;
    }

    FrameToken literal = found > position ? FrameToken.literal(copy(position, found)) : null;
    position = found;
    enterScanningForEnd();
    return literal;
  }

  private FrameToken scanForEnd() throws IOException {
    int contentStart = position + (mode == Mode.START_AND_END ? startMarker.length : 0);
    int found = indexOf(endMarker, Math.max(contentStart, scanFrom));
    if (found < 0) {
      if (endOfStream) {
        state = State.DRAINING;
      } else {
        scanFrom = Math.max(contentStart, limit - endMarker.length + 1);
        fill();
      }
      return null;
    }

    byte[] content = copy(contentStart, found);
    position = found + endMarker.length;
    if (mode == Mode.START_AND_END) {
      enterScanningForStart();
    } else {
      enterScanningForEnd();
    }
    return content.length > 0 ? FrameToken.framed(content) : null;
  }

  private FrameToken drain() throws IOException {
    while (!endOfStream) {
      fill();
    }
    state = State.DONE;
    if (limit == position) {
      return null;
    }
    byte[] remainder = copy(position, limit);
    position = limit;
    return mode == Mode.END_MARKER_ONLY ? FrameToken.framed(remainder) : FrameToken.literal(remainder);
  }

  private void enterScanningForStart() {
    state = State.SCANNING_FOR_START;
    scanFrom = position;
  }

  private void enterScanningForEnd() {
    state = State.SCANNING_FOR_END;
    scanFrom = position;
  }

  private void fill() throws IOException {
    if (position > 0) {
      System.arraycopy(buffer, position, buffer, 0, limit - position);
      limit -= position;
      scanFrom = Math.max(0, scanFrom - position);
      position = 0;
    }

    if (limit == buffer.length) {
      if (buffer.length >= maxTokenSize) {
        // A full buffer is only an overflow if the stream actually has more bytes.
        if (input.read() < 0) {
          endOfStream = true;
          return;
        }
        state = State.DONE;
        throw Problems.tokenTooLarge(
            "Message exceeds the maximum token size",
            Map.of("maxTokenSize", maxTokenSize)
        );
      }
      buffer = Arrays.copyOf(buffer, (int) Math.min((long) buffer.length * 2, maxTokenSize));
    }

    int read = input.read(buffer, limit, buffer.length - limit);
    if (read < 0) {
      endOfStream = true;
    } else {
      limit += read;
    }
  }

  private int indexOf(byte[] marker, int from) {
    int last = limit - marker.length;
    outer:
    for (int i = Math.max(from, position); i <= last; i++) {
      for (int j = 0; j < marker.length; j++) {
        if (buffer[i + j] != marker[j]) {
          continue outer;
        }
      }
      return i;
    }
    return -1;
  }

  private byte[] copy(int from, int to) {
    return Arrays.copyOfRange(buffer, from, to);
  }
}
