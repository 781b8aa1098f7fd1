package com.docrepo.repositories.mongo;

import com.docrepo.repos.certification.Note;
import com.docrepo.repos.certification.RepositoryCertification;

public class MongoRepositoryCertificationTest extends RepositoryCertification {

    @Override
    public void init() {
        repository = new MongoRepository<>(InMemoryMongo.freshCollection(), Note.class,
                Identities.timeBasedUuids(), false);
    }
}
