package eu.optima.listino.tools;

import java.util.Optional;

import eu.optima.listino.model.ColumnMapping;

/** Previously confirmed column mappings, keyed by supplier identity. */
public interface MappingStore {

    Optional<ColumnMapping> load(String supplierKey);

    void save(String supplierKey, ColumnMapping mapping);
}
