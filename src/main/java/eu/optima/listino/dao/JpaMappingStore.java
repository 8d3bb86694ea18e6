package eu.optima.listino.dao;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Optional;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import eu.optima.listino.model.ColumnMapping;
import eu.optima.listino.tools.MappingStore;

/** Mapping store backed by the supplier_mappings table; the mapping itself is kept as JSON text. */
public class JpaMappingStore implements MappingStore {
    private static final ObjectMapper M = new ObjectMapper();

    @Override
    public Optional<ColumnMapping> load(String supplierKey) {
        var row = SupplierMappingsDao.find(supplierKey);
        if (row == null)
            return Optional.empty();
        try {
            LinkedHashMap<String, String> byField = M.readValue(row.mappingJson,
                    new TypeReference<LinkedHashMap<String, String>>() {
                    });
            return Optional.of(new ColumnMapping(byField,
                    row.confirmed ? ColumnMapping.Origin.CONFIRMED : ColumnMapping.Origin.SUGGESTED));
        } catch (IOException e) {
            throw new UncheckedIOException("Corrupt mapping JSON for supplier '" + supplierKey + "'", e);
        }
    }

    @Override
    public void save(String supplierKey, ColumnMapping mapping) {
        if (supplierKey == null || supplierKey.isBlank())
            throw new IllegalArgumentException("supplier key is required");
        try {
            SupplierMappingsDao.upsert(supplierKey, M.writeValueAsString(mapping.asMap()), mapping.isApproved());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
