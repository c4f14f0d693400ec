package ca.gc.cra.pulse.application.control;

import ca.gc.cra.pulse.application.port.ClockPort;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Named wall-clock timers for the phases of a run.
 *
 * <p>Starting a name again restarts it; stopping only affects a running timer. Only stopped timers are
 * reported.</p>
 *
 * @since 0.1.0
 */
public final class TimeStats {
  /** One completed timer. */
  public record Entry(String name, Duration elapsed) {}

  private final ClockPort clock;
  private final Map<String, long[]> timers = new LinkedHashMap<>();

  public TimeStats(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public void start(String name) {
    timers.put(name, new long[] {clock.nowMillis(), -1L});
  }

  public void stop(String name) {
    long[] timer = timers.get(name);
    if (timer != null && timer[1] < 0) {
      timer[1] = clock.nowMillis();
    }
  }

  /** Completed timers in start order. */
  public List<Entry> entries() {
    List<Entry> entries = new ArrayList<>();
    for (Map.Entry<String, long[]> timer : timers.entrySet()) {
      long[] span = timer.getValue();
      if (span[1] >= 0) {
        entries.add(new Entry(timer.getKey(), Duration.ofMillis(span[1] - span[0])));
      }
    }
    return entries;
  }

  public Duration total() {
    Duration total = Duration.ZERO;
    for (Entry entry : entries()) {
      total = total.plus(entry.elapsed());
    }
    return total;
  }
}
