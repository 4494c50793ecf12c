package com.leadranker.ranking.csv;

import com.leadranker.common.model.EvalLead;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * The shared evaluation set used by canonical optimizer runs. Read from disk
 * on first use and cached for the life of the process; a missing or unreadable
 * file caches as empty.
 */
@Component
public class EvalSetSource {

    private static final Logger log = LoggerFactory.getLogger(EvalSetSource.class);

    private final Path path;
    private volatile List<EvalLead> cache;

    public EvalSetSource(@Value("${ranking.eval-set-path:eval_set.csv}") String path) {
        this.path = Path.of(path);
    }

    public List<EvalLead> get() {
        List<EvalLead> loaded = cache;
        if (loaded == null) {
            synchronized (this) {
                if (cache == null) {
                    cache = load();
                }
                loaded = cache;
            }
        }
        return loaded;
    }

    public EvalSetInfo info() {
        return EvalSetInfo.of(get());
    }

    private List<EvalLead> load() {
        if (!Files.isRegularFile(path)) {
            log.error("[EvalSet] Evaluation file not found. path={}", path.toAbsolutePath());
            return List.of();
        }
        try {
            List<EvalLead> leads = List.copyOf(EvalSetParser.parse(Files.readString(path, StandardCharsets.UTF_8)));
            log.info("[EvalSet] Evaluation set loaded. path={} leads={}", path.toAbsolutePath(), leads.size());
            return leads;
        } catch (IOException | RuntimeException e) {
            log.error("[EvalSet] Evaluation file unreadable. path={} reason={}", path.toAbsolutePath(), e.getMessage(), e);
            return List.of();
        }
    }
}
