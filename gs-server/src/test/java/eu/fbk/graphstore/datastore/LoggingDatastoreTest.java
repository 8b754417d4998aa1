package eu.fbk.graphstore.datastore;

import eu.fbk.graphstore.data.IdSpaces;

public class LoggingDatastoreTest extends AbstractDatastoreTest<String> {

    @Override
    protected Datastore<String> createDatastore() {
        return new LoggingDatastore<String>(new MemoryDatastore<String>(IdSpaces.STRING));
    }

}
