package com.acme.gateway.web.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.slf4j.Marker;

/**
 * Puts the current thread id into MDC and, on job queue threads ({@code
 * queue-<name>-<role>-<n>}), the queue name, so worker log lines can be filtered per queue.
 */
public class ThreadIdTurboFilter extends TurboFilter {
  private static final String THREAD_ID_KEY = "threadId";
  private static final String QUEUE_KEY = "queue";
  private static final Pattern QUEUE_THREAD = Pattern.compile("^queue-(.+)-(worker|handler)-\\d+$");

  @Override
  public FilterReply decide(
      Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
    Thread current = Thread.currentThread();
    MDC.put(THREAD_ID_KEY, String.valueOf(current.getId()));
    Matcher m = QUEUE_THREAD.matcher(current.getName());
    if (m.matches()) {
      MDC.put(QUEUE_KEY, m.group(1));
    } else {
      MDC.remove(QUEUE_KEY);
    }
    return FilterReply.NEUTRAL;
  }
}
