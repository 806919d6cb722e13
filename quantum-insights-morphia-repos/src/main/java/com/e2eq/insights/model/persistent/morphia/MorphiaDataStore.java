package com.e2eq.insights.model.persistent.morphia;

import com.e2eq.insights.model.persistent.CacheEntry;
import com.e2eq.insights.model.persistent.ConversationTurn;
import com.e2eq.insights.model.persistent.QuotaRecord;
import com.e2eq.insights.model.persistent.ResourceGrant;
import com.e2eq.insights.model.persistent.RoleAssignment;
import com.e2eq.insights.model.persistent.RolePermission;
import com.mongodb.client.MongoClient;
import dev.morphia.MorphiaDatastore;
import dev.morphia.config.MorphiaConfig;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Lazily creates the Morphia datastore for the insights database and maps its entities.
 */
@ApplicationScoped
public class MorphiaDataStore {

   @Inject
   MongoClient mongoClient;

   @ConfigProperty(name = "quantum.insights.mongo.database", defaultValue = "quantum-insights")
   String databaseName;

   private volatile MorphiaDatastore datastore;

   public MorphiaDatastore getDataStore() {
      MorphiaDatastore ds = datastore;
      if (ds == null) {
         synchronized (this) {
            ds = datastore;
            if (ds == null) {
               ds = createMorphiaDatastore();
               datastore = ds;
            }
         }
      }
      return ds;
   }

   private MorphiaDatastore createMorphiaDatastore() {
      Log.infof("Creating MorphiaDatastore for database: %s", databaseName);
      MorphiaConfig config = MorphiaConfig.load().database(databaseName);
      MorphiaDatastore ds = new MorphiaDatastore(mongoClient, config);
      ds.getMapper().map(RoleAssignment.class, RolePermission.class, ResourceGrant.class,
         CacheEntry.class, QuotaRecord.class, ConversationTurn.class);
      ds.ensureIndexes();
      return ds;
   }
}
