package com.metaperception.orchestrator.controller;

import com.metaperception.core.exception.InvalidPerceptionInputException;
import com.metaperception.core.model.MetaPerceptionInput;
import com.metaperception.core.model.MetaPerceptionOutput;
import com.metaperception.core.model.PerceptionState;
import com.metaperception.orchestrator.publisher.InMemoryPerceptionArtifactStore;
import com.metaperception.orchestrator.service.PerceptionCycleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/perception")
public class PerceptionController {

    private static final Logger log = LoggerFactory.getLogger(PerceptionController.class);

    private final PerceptionCycleService cycleService;
    private final InMemoryPerceptionArtifactStore artifactStore;

    public PerceptionController(PerceptionCycleService cycleService,
                                InMemoryPerceptionArtifactStore artifactStore) {
        this.cycleService  = cycleService;
        this.artifactStore = artifactStore;
    }

    @PostMapping("/{venue}/step")
    public Mono<ResponseEntity<MetaPerceptionOutput>> step(@PathVariable String venue,
                                                           @RequestBody MetaPerceptionInput input) {
        return cycleService.step(venue, input)
            .map(ResponseEntity::ok)
            .onErrorResume(InvalidPerceptionInputException.class, e -> {
                log.warn("Rejected perception input. venue={} field={} reason={}", venue, e.getField(), e.getMessage());
                return Mono.just(ResponseEntity.badRequest().build());
            });
    }

    @GetMapping("/{venue}/state")
    public Mono<ResponseEntity<PerceptionState>> state(@PathVariable String venue) {
        return cycleService.currentState(venue)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{venue}/state")
    public Mono<ResponseEntity<Void>> reset(@PathVariable String venue) {
        return cycleService.reset(venue)
            .map(existed -> existed
                ? ResponseEntity.noContent().<Void>build()
                : ResponseEntity.notFound().<Void>build());
    }

    @GetMapping(value = "/{venue}/artifacts/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<String>> artifact(@PathVariable String venue, @PathVariable String id) {
        return Mono.justOrEmpty(artifactStore.find(venue, id))
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}
