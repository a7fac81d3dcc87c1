package com.gentoro.twinsync.reverse;

import com.gentoro.twinsync.exception.TwinSyncErrorCode;
import com.gentoro.twinsync.exception.TwinSyncException;
import com.gentoro.twinsync.utility.JacksonUtility;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads cloud events appended to a file, one JSON object per line, remembering the read offset
 * between polls. Lines that fail to decode are logged and skipped.
 */
public class JsonLinesNotificationSource implements ChangeNotificationSource {
  private static final org.slf4j.Logger log =
      com.gentoro.twinsync.logging.LoggingService.getLogger(JsonLinesNotificationSource.class);

  private final Path file;
  private long offset;
  private long lineNumber;

  public JsonLinesNotificationSource(Path file) {
    this.file = file;
  }

  @Override
  public synchronized List<ChangeEvent> poll() {
    List<ChangeEvent> events = new ArrayList<>();
    if (!Files.exists(file)) {
      return events;
    }
    try (RandomAccessFile in = new RandomAccessFile(file.toFile(), "r")) {
      if (in.length() < offset) {
        log.warn("Notification file '{}' was truncated; reading from the start", file);
        offset = 0;
        lineNumber = 0;
      }
      in.seek(offset);
      byte[] remaining = new byte[(int) (in.length() - offset)];
      in.readFully(remaining);
      int start = 0;
      for (int i = 0; i < remaining.length; i++) {
        if (remaining[i] != '\n') continue;
        String line = new String(remaining, start, i - start, StandardCharsets.UTF_8).trim();
        start = i + 1;
        lineNumber++;
        if (!line.isEmpty()) {
          decode(line).ifPresent(events::add);
        }
      }
      // an unterminated last line is left for the next poll
      offset += start;
    } catch (IOException e) {
      throw new TwinSyncException(
          TwinSyncErrorCode.IO_ERROR,
          "Failed to read notifications from " + file,
          Map.of("file", file.toString()),
          e);
    }
    return events;
  }

  private Optional<ChangeEvent> decode(String line) {
    try {
      return Optional.of(ChangeEventDecoder.decode(JacksonUtility.readTree(line)));
    } catch (TwinSyncException e) {
      log.error(
          "Skipping notification at {}:{}: {} {}",
          file,
          lineNumber,
          e.getMessage(),
          e.getContext());
      return Optional.empty();
    }
  }
}
