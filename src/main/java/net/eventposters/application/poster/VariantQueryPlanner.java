package net.eventposters.application.poster;

import java.util.ArrayList;
import java.util.List;
import net.eventposters.domain.poster.EventRecord;
import net.eventposters.domain.poster.VariantRequest;
import org.springframework.stereotype.Component;

/**
 * Plans the background queries of a variant batch.
 *
 * <p>With explicit keywords every variant reuses them on consecutive result pages.
 * Without keywords the queries are derived from the title and venue; when the batch is
 * larger than the derived list the list repeats on the next result page.
 */
@Component
public class VariantQueryPlanner {

    private static final String DEFAULT_SUBJECT = "event";

    public List<VariantRequest> plan(EventRecord event, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1 but was " + batchSize);
        }
        List<VariantRequest> requests = new ArrayList<>(batchSize);
        if (event.backgroundQuery() != null) {
            for (int i = 0; i < batchSize; i++) {
                requests.add(new VariantRequest(i, event.backgroundQuery(), i + 1));
            }
            return List.copyOf(requests);
        }
        List<String> derived = derivedQueries(event);
        for (int i = 0; i < batchSize; i++) {
            requests.add(new VariantRequest(i, derived.get(i % derived.size()), i / derived.size() + 1));
        }
        return List.copyOf(requests);
    }

    List<String> derivedQueries(EventRecord event) {
        String subject = event.titleLines().isEmpty() ? DEFAULT_SUBJECT : event.titleLines().get(0);
        String venue = event.venue();
        return List.of(
            subject,
            join("celebration", subject),
            join("event venue", venue),
            "event decoration",
            join("party", venue)
        );
    }

    private static String join(String prefix, String value) {
        return value == null || value.isBlank() ? prefix : prefix + " " + value;
    }
}
