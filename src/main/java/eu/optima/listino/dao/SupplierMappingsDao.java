package eu.optima.listino.dao;

import java.time.LocalDateTime;

import eu.optima.listino.jpa.Jpa;
import eu.optima.listino.model.SupplierMapping;

public class SupplierMappingsDao {

    public static SupplierMapping find(String supplierKey) {
        return Jpa.tx(em -> em.find(SupplierMapping.class, supplierKey));
    }

    public static void upsert(String supplierKey, String mappingJson, boolean confirmed) {
        Jpa.txVoid(em -> {
            var now = LocalDateTime.now(java.time.ZoneOffset.UTC);
            var row = em.find(SupplierMapping.class, supplierKey);
            if (row == null) {
                row = new SupplierMapping();
                row.supplierKey = supplierKey;
                row.insertedAt = now;
                row.mappingJson = mappingJson;
                row.confirmed = confirmed;
                row.updatedAt = now;
                em.persist(row);
            } else {
                row.mappingJson = mappingJson;
                row.confirmed = confirmed;
                row.updatedAt = now;
            }
        });
    }

    public static int delete(String supplierKey) {
        return Jpa.tx(em -> em.createQuery("DELETE FROM SupplierMapping m WHERE m.supplierKey = :k")
                .setParameter("k", supplierKey)
                .executeUpdate());
    }
}
