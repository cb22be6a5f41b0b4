package eu.fbk.ebes.scoring;

import org.slf4j.Logger;

/**
 * Logs the advancement of a scoring loop every 10% of processed candidates.
 */
final class Progress {

    private final Logger logger;

    private final String label;

    private final int total;

    private int done;

    private int lastReported;

    Progress(final Logger logger, final String label, final int total) {
        this.logger = logger;
        this.label = label;
        this.total = total;
    }

    void increment() {
        ++this.done;
        final int percent = this.total == 0 ? 100 : this.done * 100 / this.total;
        if (percent / 10 > this.lastReported / 10) {
            this.lastReported = percent;
            this.logger.info("{} scoring: {}% ({}/{} candidates)", this.label, percent,
                    this.done, this.total);
        }
    }

}
