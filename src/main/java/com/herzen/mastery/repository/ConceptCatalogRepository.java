package com.herzen.mastery.repository;

import com.herzen.mastery.graph.KnowledgeGraphModels.ConceptCatalog;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class ConceptCatalogRepository {
    private final Map<String, ConceptCatalog> catalogs = new ConcurrentHashMap<>();

    public void save(ConceptCatalog catalog) {
        catalogs.put(catalog.catalogId(), catalog);
    }

    public Optional<ConceptCatalog> find(String catalogId) {
        return catalogId == null ? Optional.empty() : Optional.ofNullable(catalogs.get(catalogId));
    }

    public List<String> catalogIds() {
        return catalogs.keySet().stream().sorted().toList();
    }

    public boolean delete(String catalogId) {
        return catalogs.remove(catalogId) != null;
    }
}
