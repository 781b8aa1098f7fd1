package com.docrepo.repositories.mongo;

import com.docrepo.repos.certification.Note;
import com.docrepo.repos.certification.ServiceCertification;

public class MongoServiceCertificationTest extends ServiceCertification {

    @Override
    public void init() {
        repository = new MongoRepository<>(InMemoryMongo.freshCollection(), Note.class,
                Identities.timeBasedUuids(), false);
        mapper = BsonModule.objectMapper();
    }
}
