package im.arun.docsync.report;

import im.arun.docsync.model.ActionRecord;
import im.arun.docsync.model.ActionResult;
import im.arun.docsync.model.DiscourseConfigDescriptor;
import im.arun.docsync.model.SyncReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collects the records of a run, possibly from several worker threads, and
 * produces the final {@link SyncReport} in sequence order.
 */
public class ResultReporter {
    private static final Logger logger = LoggerFactory.getLogger(ResultReporter.class);

    private final Map<Integer, ActionRecord> records = new TreeMap<>();

    public synchronized void record(ActionRecord record) {
        ActionRecord previous = records.put(record.getSequence(), record);
        if (previous != null) {
            logger.warn("Replacing record {} for sequence {}", previous, record.getSequence());
        }
    }

    public synchronized ActionRecord get(int sequence) {
        return records.get(sequence);
    }

    public synchronized List<ActionRecord> getRecords() {
        return Collections.unmodifiableList(new ArrayList<>(records.values()));
    }

    /**
     * Build the report. The URL map only lists real topic URLs; group rows and
     * topics that a dry run did not create appear in the record list only.
     */
    public synchronized SyncReport build(String indexUrl, DiscourseConfigDescriptor descriptor) {
        List<ActionRecord> ordered = new ArrayList<>(records.values());
        Map<String, ActionResult> urlsWithActions = new LinkedHashMap<>();
        for (ActionRecord record : ordered) {
            if (record.hasTopicUrl()) {
                urlsWithActions.put(record.getUrl(), new ActionResult(record.getKind(), record.getOutcome()));
            }
        }
        return new SyncReport(
                Collections.unmodifiableMap(urlsWithActions),
                indexUrl,
                descriptor,
                Collections.unmodifiableList(ordered));
    }
}
