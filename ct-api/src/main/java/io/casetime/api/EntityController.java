package io.casetime.api;

import io.casetime.core.EntityDescription;
import io.casetime.core.EntityKind;
import io.casetime.core.OwnerRef;
import io.casetime.store.EntityRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/** Registers the descriptions that facts are rendered with. */
@RestController
@RequestMapping("/api/entities")
public class EntityController {
    private final EntityRegistry entities;
    public EntityController(EntityRegistry entities){ this.entities = entities; }

    @PutMapping("/{kind}/{entityId}")
    public ResponseEntity<Map<String, Object>> upsert(@PathVariable("kind") String kind,
                                                      @PathVariable("entityId") String entityId,
                                                      @RequestBody EntityDescription body) {
        var owner = new OwnerRef(EntityKind.parse(kind), entityId);
        entities.upsert(owner, body);
        return ResponseEntity.ok(Map.of("owner", owner.toString()));
    }

    @GetMapping("/{kind}/{entityId}")
    public ResponseEntity<EntityDescription> get(@PathVariable("kind") String kind,
                                                 @PathVariable("entityId") String entityId) {
        var owner = new OwnerRef(EntityKind.parse(kind), entityId);
        return entities.resolve(owner)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
