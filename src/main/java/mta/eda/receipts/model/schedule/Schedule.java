package mta.eda.receipts.model.schedule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The result of one scheduling call. Entries keep the input order; the scheduler sorts
 * them by delay when it runs.
 */
public record Schedule(List<ScheduleEntry> entries, int total) {

    public Schedule {
        entries = List.copyOf(entries);
    }

    public static Schedule of(List<ScheduleEntry> entries) {
        return new Schedule(entries, entries.size());
    }

    /**
     * @return order id to delay, in input order
     */
    public Map<String, Long> timing() {
        Map<String, Long> timing = new LinkedHashMap<>();
        for (ScheduleEntry entry : entries) {
            timing.put(entry.order().id(), entry.delay());
        }
        return Collections.unmodifiableMap(timing);
    }

    public List<Long> delays() {
        return entries.stream().map(ScheduleEntry::delay).toList();
    }
}
