package br.edu.ifba.graphqa.centrality;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Periodically recomputes centrality over the whole graph.
 * Disabled unless {@code kgqa.centrality.refresh.every} is set to an interval.
 */
@ApplicationScoped
public class CentralityRefreshJob {

    private static final Logger LOG = Logger.getLogger(CentralityRefreshJob.class);

    @Inject
    CentralityService centralityService;

    @Scheduled(every = "{kgqa.centrality.refresh.every}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void refresh() {
        final long startTime = System.currentTimeMillis();
        LOG.info("Starting centrality refresh job...");
        try {
            CentralityReport report = centralityService.recompute(null, null);
            LOG.infof("Centrality refresh stored %d scores (converged=%s)",
                report.scoresStored(), report.converged());
        } catch (GraphEmptyException e) {
            LOG.info("Graph is empty, nothing to score.");
        }
        final long executionTime = System.currentTimeMillis() - startTime;
        LOG.infof("Centrality refresh job completed in %d ms", executionTime);
    }
}
