package com.leadranker.ranking.store;

import com.leadranker.ranking.model.Prompt;
import com.leadranker.ranking.repository.PromptRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Component
public class R2dbcPromptStore implements PromptStore {

    private final PromptRepository repository;

    public R2dbcPromptStore(PromptRepository repository) {
        this.repository = repository;
    }

    @Override
    public Mono<PromptVersion> findActive() {
        return repository.findFirstByActiveTrueOrderByVersionDesc().map(R2dbcPromptStore::toVersion);
    }

    @Override
    public Mono<PromptVersion> findByVersion(int version) {
        return repository.findByVersion(version).map(R2dbcPromptStore::toVersion);
    }

    @Override
    public Mono<Integer> findMaxVersion() {
        return repository.findMaxVersion().defaultIfEmpty(0);
    }

    @Override
    public Mono<PromptVersion> insert(PromptVersion prompt) {
        Prompt entity = new Prompt();
        entity.setVersion(prompt.version());
        entity.setContent(prompt.content());
        entity.setEvalScore(prompt.evalScore());
        entity.setActive(prompt.active());
        entity.setGeneration(prompt.generation());
        entity.setParentVersion(prompt.parentVersion());
        entity.setCreatedAt(LocalDateTime.now());
        return repository.save(entity).map(R2dbcPromptStore::toVersion);
    }

    @Override
    @Transactional
    public Mono<Boolean> activate(int version) {
        return repository.findByVersion(version)
            .flatMap(found -> repository.deactivateAll()
                .then(repository.activateVersion(version))
                .map(updated -> updated > 0))
            .defaultIfEmpty(false);
    }

    @Override
    public Flux<PromptVersion> findAllByVersionDesc() {
        return repository.findAllByOrderByVersionDesc().map(R2dbcPromptStore::toVersion);
    }

    private static PromptVersion toVersion(Prompt p) {
        return new PromptVersion(p.getVersion(), p.getContent(), p.getEvalScore(),
            Boolean.TRUE.equals(p.getActive()), p.getGeneration(), p.getParentVersion(), p.getCreatedAt());
    }
}
