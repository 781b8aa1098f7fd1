/**
 * MongoDB implementation of the Repository and NestedRepository interfaces.
 * 
 * Records are stored one per document, keyed by {@code _id}. Embedded arrays
 * are read through aggregation pipelines and written in place with
 * {@code $push}, {@code $pull} and the positional operator.
 * 
 * Files go to GridFS through {@link com.docrepo.repositories.mongo.GridFsBlobStore}.
 */
package com.docrepo.repositories.mongo;
