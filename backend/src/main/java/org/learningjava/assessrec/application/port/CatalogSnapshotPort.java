package org.learningjava.assessrec.application.port;

import org.learningjava.assessrec.domain.model.catalog.CatalogItem;

import java.nio.file.Path;
import java.util.List;

public interface CatalogSnapshotPort {
    List<CatalogItem> read(Path snapshot); // rows in file order
}
