package org.neuralchilli.planwright.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import com.hazelcast.nio.serialization.StreamSerializer;
import org.neuralchilli.planwright.domain.GatingRule;
import org.neuralchilli.planwright.domain.Phase;
import org.neuralchilli.planwright.domain.Plan;
import org.neuralchilli.planwright.domain.Priority;
import org.neuralchilli.planwright.domain.StatusRecord;
import org.neuralchilli.planwright.domain.WorkItem;
import org.neuralchilli.planwright.domain.WorkItemKind;
import org.neuralchilli.planwright.domain.WorkStatus;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Custom binary serializer for the whole status record.
 * Enums are written as ordinals, optional fields behind a presence flag.
 * The derived plan status and summary are not stored.
 */
public class StatusRecordSerializer implements StreamSerializer<StatusRecord> {

    private static final int TYPE_ID = 2001;

    @Override
    public int getTypeId() {
        return TYPE_ID;
    }

    @Override
    public void write(ObjectDataOutput out, StatusRecord record) throws IOException {
        out.writeLong(record.revision());
        writeInstantOrNull(out, record.lastUpdated());

        out.writeInt(record.phases().size());
        for (Phase phase : record.phases()) {
            out.writeString(phase.id());
            out.writeInt(phase.gatingRule() != null ? phase.gatingRule().ordinal() : -1);
            writeStringList(out, phase.planIds());
        }

        out.writeInt(record.plans().size());
        for (Plan plan : record.plans()) {
            out.writeString(plan.id());
            out.writeString(plan.phaseId());
            out.writeInt(plan.items().size());
            for (WorkItem item : plan.items()) {
                writeItem(out, item);
            }
        }
    }

    @Override
    public StatusRecord read(ObjectDataInput in) throws IOException {
        long revision = in.readLong();
        Instant lastUpdated = readInstantOrNull(in);

        int phaseCount = in.readInt();
        List<Phase> phases = new ArrayList<>(phaseCount);
        for (int i = 0; i < phaseCount; i++) {
            String id = in.readString();
            int rule = in.readInt();
            List<String> planIds = readStringList(in);
            phases.add(new Phase(id, rule >= 0 ? GatingRule.values()[rule] : null, planIds));
        }

        int planCount = in.readInt();
        List<Plan> plans = new ArrayList<>(planCount);
        for (int i = 0; i < planCount; i++) {
            String id = in.readString();
            String phaseId = in.readString();
            int itemCount = in.readInt();
            List<WorkItem> items = new ArrayList<>(itemCount);
            for (int j = 0; j < itemCount; j++) {
                items.add(readItem(in));
            }
            plans.add(new Plan(id, phaseId, items));
        }

        return new StatusRecord(revision, lastUpdated, phases, plans);
    }

    private void writeItem(ObjectDataOutput out, WorkItem item) throws IOException {
        out.writeString(item.id());
        out.writeInt(item.kind().ordinal());
        out.writeInt(item.status().ordinal());
        out.writeInt(item.priority().ordinal());
        writeStringList(out, item.dependsOn());
        out.writeBoolean(item.parallelizable());
        writeStringOrNull(out, item.exclusivityGroup());
        writeStringOrNull(out, item.deliverable());
        out.writeLong(item.revision());
        writeInstantOrNull(out, item.lastUpdated());
    }

    private WorkItem readItem(ObjectDataInput in) throws IOException {
        String id = in.readString();
        WorkItemKind kind = WorkItemKind.values()[in.readInt()];
        WorkStatus status = WorkStatus.values()[in.readInt()];
        Priority priority = Priority.values()[in.readInt()];
        List<String> dependsOn = readStringList(in);
        boolean parallelizable = in.readBoolean();
        String exclusivityGroup = readStringOrNull(in);
        String deliverable = readStringOrNull(in);
        long revision = in.readLong();
        Instant lastUpdated = readInstantOrNull(in);

        return new WorkItem(id, kind, status, priority, dependsOn, parallelizable,
                exclusivityGroup, deliverable, revision, lastUpdated);
    }

    private void writeStringList(ObjectDataOutput out, List<String> values) throws IOException {
        out.writeInt(values.size());
        for (String value : values) {
            out.writeString(value);
        }
    }

    private List<String> readStringList(ObjectDataInput in) throws IOException {
        int size = in.readInt();
        if (size == 0) {
            return List.of();
        }
        List<String> values = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            values.add(in.readString());
        }
        return values;
    }

    private void writeStringOrNull(ObjectDataOutput out, String value) throws IOException {
        out.writeBoolean(value != null);
        if (value != null) {
            out.writeString(value);
        }
    }

    private String readStringOrNull(ObjectDataInput in) throws IOException {
        return in.readBoolean() ? in.readString() : null;
    }

    private void writeInstantOrNull(ObjectDataOutput out, Instant value) throws IOException {
        out.writeBoolean(value != null);
        if (value != null) {
            out.writeLong(value.getEpochSecond());
            out.writeInt(value.getNano());
        }
    }

    private Instant readInstantOrNull(ObjectDataInput in) throws IOException {
        return in.readBoolean() ? Instant.ofEpochSecond(in.readLong(), in.readInt()) : null;
    }
}
