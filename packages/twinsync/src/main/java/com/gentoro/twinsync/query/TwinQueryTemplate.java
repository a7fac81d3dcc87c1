package com.gentoro.twinsync.query;

import com.gentoro.twinsync.exception.ValidationException;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Twin graph query text with a single {@value #PLACEHOLDER} slot for an id list.
 *
 * @param resultKey column under which each result row carries its twin or relationship
 */
public record TwinQueryTemplate(String name, String text, String resultKey) {
  public static final String PLACEHOLDER = "<_:_>";

  public static final TwinQueryTemplate TWINS_BY_ID =
      new TwinQueryTemplate(
          "twins-by-id", "SELECT T FROM DIGITALTWINS T WHERE T.$dtId IN " + PLACEHOLDER, "T");

  /** Parent relationships pointing at the given twins, i.e. the children lookup. */
  public static final TwinQueryTemplate CHILD_RELATIONSHIPS =
      new TwinQueryTemplate(
          "child-relationships",
          "SELECT R FROM RELATIONSHIPS R WHERE R.$relationshipName = 'parent' AND R.$targetId IN "
              + PLACEHOLDER,
          "R");

  public static final TwinQueryTemplate OUTGOING_RELATIONSHIPS =
      new TwinQueryTemplate(
          "outgoing-relationships",
          "SELECT R FROM RELATIONSHIPS R WHERE R.$sourceId IN " + PLACEHOLDER,
          "R");

  public static final TwinQueryTemplate INCOMING_RELATIONSHIPS =
      new TwinQueryTemplate(
          "incoming-relationships",
          "SELECT R FROM RELATIONSHIPS R WHERE R.$targetId IN " + PLACEHOLDER,
          "R");

  public TwinQueryTemplate {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(resultKey, "resultKey");
    if (text == null || !text.contains(PLACEHOLDER)) {
      throw new ValidationException("Query template '" + name + "' lacks " + PLACEHOLDER);
    }
  }

  /** Renders {@code ['a', 'b']} into the placeholder; single quotes in ids are escaped. */
  public String render(List<String> ids) {
    String list =
        ids.stream()
            .map(id -> "'" + id.replace("\\", "\\\\").replace("'", "\\'") + "'")
            .collect(Collectors.joining(", ", "[", "]"));
    return text.replace(PLACEHOLDER, list);
  }
}
