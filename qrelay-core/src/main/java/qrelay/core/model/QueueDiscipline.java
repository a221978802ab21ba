package qrelay.core.model;

import java.util.Comparator;
import java.util.Locale;

/**
 * Queue types. Disciplines only differ in the order in which {@code receive} picks
 * eligible messages, so each constant carries its selection order.
 */
public enum QueueDiscipline {
    STANDARD("standard", Comparator.comparingLong(Message::sequence)),
    FIFO("fifo", Comparator.comparingLong(Message::sequence)),
    PRIORITY("priority", (a, b) -> a.priority() != b.priority()
            ? Integer.compare(b.priority(), a.priority())
            : Long.compare(a.sequence(), b.sequence())),
    DELAY("delay", Comparator.comparingLong(Message::sequence)),
    DLQ("dlq", Comparator.comparingLong(Message::sequence));

    private final String value;
    private final Comparator<Message> selectionOrder;

    QueueDiscipline(String value, Comparator<Message> selectionOrder) {
        this.value = value;
        this.selectionOrder = selectionOrder;
    }

    public String getValue() {
        return value;
    }

    public Comparator<Message> selectionOrder() {
        return selectionOrder;
    }

    // FIFO queues never reorder messages sharing an ordering group
    public boolean isGroupOrdered() {
        return this == FIFO;
    }

    public static QueueDiscipline fromValue(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("dead_letter") || normalized.equals("dead-letter")) {
            return DLQ;
        }
        for (QueueDiscipline discipline : values()) {
            if (discipline.value.equals(normalized)) {
                return discipline;
            }
        }
        throw new IllegalArgumentException("Unknown queue discipline: " + value);
    }
}
