package com.e2eq.insights.model.persistent;

import com.e2eq.insights.model.usage.QuotaPeriod;
import dev.morphia.annotations.Entity;
import dev.morphia.annotations.Field;
import dev.morphia.annotations.Id;
import dev.morphia.annotations.Index;
import dev.morphia.annotations.IndexOptions;
import dev.morphia.annotations.Indexes;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.bson.types.ObjectId;

import java.time.Instant;

/**
 * Token consumption of one identity in one quota period. A new record starts at every period
 * boundary. {@code limitOverride}, when set, replaces the configured limit for that identity.
 */
@Data
@NoArgsConstructor
@RegisterForReflection
@Entity(value = "quotaRecords", useDiscriminator = false)
@Indexes({
    @Index(fields = {@Field("userId"), @Field("period"), @Field("periodStart")}, options = @IndexOptions(unique = true))
})
public class QuotaRecord {

    @Id
    private ObjectId id;

    private String userId;

    private QuotaPeriod period;

    private Instant periodStart;

    private Instant periodEnd;

    private long tokensConsumed;

    private long requestCount;

    private Long limitOverride;

    private Instant updatedAt;
}
