package com.docrepo.repositories.mongo;

import com.docrepo.core.Filter;
import com.docrepo.core.errors.BadRequestException;
import com.docrepo.repos.certification.Comment;
import com.docrepo.repos.certification.Note;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConvertersTest {

    @Test
    void toDocumentShouldRenameIdsAtEveryDepth() {
        Note note = new Note("Title", "open");
        note.setId("parent");
        Comment comment = new Comment();
        comment.setId("child");
        comment.setText("hi");
        note.getComments().add(comment);

        Document doc = Converters.toDocument(note);

        assertEquals("parent", doc.get("_id"));
        assertFalse(doc.containsKey("id"));
        Document element = (Document) doc.getList("comments", Object.class).get(0);
        assertEquals("child", element.get("_id"));
        assertFalse(element.containsKey("id"));
    }

    @Test
    void toDocumentShouldKeepInstantsAsDates() {
        Note note = new Note("Title", "open");
        note.setCreatedAt(Instant.ofEpochMilli(1_700_000_000_000L));

        Document doc = Converters.toDocument(note);

        assertEquals(new Date(1_700_000_000_000L), doc.get("createdAt"));
    }

    @Test
    void fromDocumentShouldRestoreIdsAndInstants() {
        Document doc = new Document("_id", "n1")
                .append("title", "Stored")
                .append("createdAt", new Date(1_700_000_000_000L))
                .append("comments", List.of(new Document("_id", "c1").append("text", "x")))
                .append("unknown", "ignored");

        Note note = Converters.fromDocument(doc, Note.class);

        assertEquals("n1", note.getId());
        assertEquals(Instant.ofEpochMilli(1_700_000_000_000L), note.getCreatedAt());
        assertEquals("c1", note.getComments().get(0).getId());
    }

    @Test
    void toQueryShouldRenameTheIdFieldOnly() {
        ObjectId id = new ObjectId();

        Document query = Converters.toQuery(Filter.where("id", id).and("status", "open"));

        assertEquals(new Document("_id", id).append("status", "open"), query);
        assertTrue(Converters.toQuery(null).isEmpty());
    }

    @Test
    void bigIntegersShouldBecomeLongsOrBeRejected() {
        Document element = (Document) Converters.toBsonValue(Map.of("votes", new BigInteger("7")));

        assertEquals(7L, element.get("votes"));
        assertThrows(BadRequestException.class,
                () -> Converters.toBsonValue(List.of(BigInteger.ONE.shiftLeft(64))));
    }

    @Test
    void jsonShouldCarryObjectIdsAsHexAndInstantsAsIsoStrings() throws Exception {
        ObjectMapper mapper = BsonModule.objectMapper();
        ObjectId id = new ObjectId();
        Attachment attachment = new Attachment("a.txt", 3);
        attachment.setId(id);
        attachment.setCreatedAt(Instant.parse("2024-01-02T03:04:05.006Z"));

        String json = mapper.writeValueAsString(attachment);
        Map<?, ?> fields = mapper.readValue(json, Map.class);

        assertEquals(id.toHexString(), fields.get("id"));
        assertEquals("2024-01-02T03:04:05.006Z", fields.get("createdAt"));
        assertEquals(attachment, mapper.readValue(json, Attachment.class));
    }

    @Test
    void invalidObjectIdStringsShouldBeRejected() {
        ObjectMapper mapper = BsonModule.objectMapper();

        assertThrows(Exception.class, () -> mapper.readValue("{\"id\":\"not-an-id\"}", Attachment.class));
    }
}
