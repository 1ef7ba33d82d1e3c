package br.edu.ifba.graphqa.storage;

/**
 * Shared limit on the work a set of traversals may do.
 * Stores consult it before expanding each node.
 */
public interface TraversalBudget {

    /**
     * Records the visit of one node.
     *
     * @return false when the budget is exhausted or cancelled and expansion must stop
     */
    boolean tryVisit();

    boolean isCancelled();

    static TraversalBudget unlimited() {
        return new TraversalBudget() {
            @Override
            public boolean tryVisit() {
                return true;
            }

            @Override
            public boolean isCancelled() {
                return false;
            }
        };
    }
}
