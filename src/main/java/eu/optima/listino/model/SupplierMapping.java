package eu.optima.listino.model;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "supplier_mappings", schema = "public")
public class SupplierMapping {
  @Id
  @Column(name = "supplier_key", length = 255)
  public String supplierKey;

  @Column(name = "mapping_json", length = 8000, nullable = false)
  public String mappingJson; // field -> column, JSON as text

  @Column(nullable = false)
  public boolean confirmed;

  @Column(name = "inserted_at", nullable = false)
  public LocalDateTime insertedAt;

  @Column(name = "updated_at", nullable = false)
  public LocalDateTime updatedAt;
}
