package org.learningjava.assessrec.application.port;

import org.learningjava.assessrec.domain.model.evaluation.LabeledQuery;

import java.nio.file.Path;
import java.util.List;

public interface LabeledQueryPort {
    List<LabeledQuery> read(Path labeledSet); // grouped by query, first-seen order
}
