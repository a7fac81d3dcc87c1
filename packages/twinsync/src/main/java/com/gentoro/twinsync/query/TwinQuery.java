package com.gentoro.twinsync.query;

import java.util.List;

/** A template bound to one chunk of ids. */
public record TwinQuery(TwinQueryTemplate template, List<String> ids) {

  public TwinQuery {
    ids = List.copyOf(ids);
  }

  public String text() {
    return template.render(ids);
  }
}
