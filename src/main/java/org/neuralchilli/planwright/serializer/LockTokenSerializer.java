package org.neuralchilli.planwright.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import com.hazelcast.nio.serialization.StreamSerializer;
import org.neuralchilli.planwright.domain.LockToken;

import java.io.IOException;
import java.time.Instant;

/**
 * Compact binary serializer for the store lock token.
 * Output is deterministic so conditional replace/remove compare tokens by value.
 */
public class LockTokenSerializer implements StreamSerializer<LockToken> {

    private static final int TYPE_ID = 2002;

    @Override
    public int getTypeId() {
        return TYPE_ID;
    }

    @Override
    public void write(ObjectDataOutput out, LockToken token) throws IOException {
        out.writeString(token.name());
        out.writeString(token.owner());

        // Full nanosecond precision
        out.writeLong(token.acquiredAt().getEpochSecond());
        out.writeInt(token.acquiredAt().getNano());

        out.writeBoolean(token.reclaimedFrom() != null);
        if (token.reclaimedFrom() != null) {
            out.writeString(token.reclaimedFrom());
        }
    }

    @Override
    public LockToken read(ObjectDataInput in) throws IOException {
        String name = in.readString();
        String owner = in.readString();
        Instant acquiredAt = Instant.ofEpochSecond(in.readLong(), in.readInt());
        String reclaimedFrom = in.readBoolean() ? in.readString() : null;

        return new LockToken(name, owner, acquiredAt, reclaimedFrom);
    }
}
