package io.borgqueue.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Named counter backing integer ids.
 */
@Document(collection = "sequences")
public class SequenceDocument {

    @Id
    private String id;

    private long seq;

    public SequenceDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public long getSeq() {
        return seq;
    }

    public void setSeq(long seq) {
        this.seq = seq;
    }
}
