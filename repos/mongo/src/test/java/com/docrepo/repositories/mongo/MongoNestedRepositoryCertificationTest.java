package com.docrepo.repositories.mongo;

import com.docrepo.repos.certification.NestedRepositoryCertification;
import com.docrepo.repos.certification.Note;

public class MongoNestedRepositoryCertificationTest extends NestedRepositoryCertification {

    @Override
    public void init() {
        MongoRepository<Note, String> mongo = new MongoRepository<>(InMemoryMongo.freshCollection(), Note.class,
                Identities.timeBasedUuids(), false);
        repository = mongo;
        nested = mongo;
    }
}
