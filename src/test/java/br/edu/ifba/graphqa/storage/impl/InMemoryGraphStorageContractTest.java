package br.edu.ifba.graphqa.storage.impl;

import br.edu.ifba.graphqa.storage.GraphStorage;

class InMemoryGraphStorageContractTest extends GraphStorageContractTest {

    @Override
    protected GraphStorage createStorage() {
        InMemoryGraphStorage inMemory = new InMemoryGraphStorage();
        inMemory.initialize().join();
        return inMemory;
    }
}
