package com.gentoro.twinsync.reverse;

import java.util.List;

/** Pull-based feed of decoded twin graph change notifications, in delivery order. */
public interface ChangeNotificationSource extends AutoCloseable {

  /** Next notifications, possibly empty when nothing new has arrived. */
  List<ChangeEvent> poll();

  @Override
  default void close() {}
}
