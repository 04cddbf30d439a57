package br.edu.ifba.ontology.ingestion;

/**
 * Notified after the ingestion pipeline has durably written a batch.
 */
@FunctionalInterface
public interface BatchCommitListener {

    /**
     * @param entities number of entities written by the batch
     * @param relationships number of relationships written by the batch
     */
    void onBatchCommitted(int entities, int relationships);
}
