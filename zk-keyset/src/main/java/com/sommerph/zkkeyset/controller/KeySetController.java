package com.sommerph.zkkeyset.controller;

import com.sommerph.zkkeyset.commitment.Commitment;
import com.sommerph.zkkeyset.keyset.BestFit;
import com.sommerph.zkkeyset.keyset.VerifierKeySet;
import com.sommerph.zkkeyset.model.key.KeySize;
import com.sommerph.zkkeyset.model.key.TransactionVerifyingKey;
import com.sommerph.zkkeyset.service.KeyKind;
import com.sommerph.zkkeyset.service.KeySetNotFoundException;
import com.sommerph.zkkeyset.service.KeySetService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/keysets")
@RequiredArgsConstructor
@Tag(name = "Key Sets", description = "Endpoints for registering verifier key sets and looking up keys by transaction size")
public class KeySetController {

    private final KeySetService keySetService;

    @Operation(summary = "List the names of all registered verifier key sets")
    @GetMapping
    public ResponseEntity<?> listKeySets() {
        return ResponseEntity.ok(keySetService.verifierKeySetNames());
    }

    @Operation(summary = "Register a verifier key set under the given name")
    @PutMapping("/{name}")
    public ResponseEntity<?> registerKeySet(@PathVariable @NotBlank String name, @RequestBody VerifierKeySet keySet) {
        log.info("Register verifier key set: {}", name);
        try {
            Commitment commitment = keySetService.registerVerifierKeySet(name, keySet);
            return ResponseEntity.ok(new CommitmentResponse(name, commitment.toHex()));
        } catch (IllegalArgumentException e) {
            log.error("Rejected verifier key set: {}", name, e);
            return ResponseEntity.badRequest().body("Invalid verifier key set: " + e.getMessage());
        } catch (Exception e) {
            log.error("Failed to register verifier key set: {}", name, e);
            return ResponseEntity.internalServerError().body("Error registering verifier key set: " + e.getMessage());
        }
    }

    @Operation(summary = "Get the commitment to a verifier key set")
    @GetMapping("/{name}/commitment")
    public ResponseEntity<?> getCommitment(@PathVariable @NotBlank String name) {
        return handle(name, () -> ResponseEntity.ok(new CommitmentResponse(name, keySetService.commitment(name).toHex())));
    }

    @Operation(summary = "List the sizes supported for a key kind (transfer or freeze)")
    @GetMapping("/{name}/{kind}/sizes")
    public ResponseEntity<?> getSizes(@PathVariable @NotBlank String name, @PathVariable String kind) {
        return handle(name, () -> ResponseEntity.ok(keySetService.supportedSizes(name, KeyKind.fromName(kind))));
    }

    @Operation(summary = "Get the largest size supported for a key kind")
    @GetMapping("/{name}/{kind}/max-size")
    public ResponseEntity<?> getMaxSize(@PathVariable @NotBlank String name, @PathVariable String kind) {
        return handle(name, () -> ResponseEntity.ok(keySetService.maxSize(name, KeyKind.fromName(kind))));
    }

    @Operation(summary = "Get the verifying key for exactly the given size")
    @GetMapping("/{name}/{kind}/exact-fit")
    public ResponseEntity<?> getExactFit(@PathVariable @NotBlank String name,
                                         @PathVariable String kind,
                                         @RequestParam @Min(0) int numInputs,
                                         @RequestParam @Min(0) int numOutputs) {
        log.info("Exact fit lookup in {} for {} keys of size ({}, {})", name, kind, numInputs, numOutputs);
        return handle(name, () -> keySetService.exactFitVerifyingKey(name, KeyKind.fromName(kind), numInputs, numOutputs)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body("No " + kind + " key of size (" + numInputs + ", " + numOutputs + ") in " + name)));
    }

    @Operation(summary = "Get the smallest verifying key that supports at least the given size")
    @GetMapping("/{name}/{kind}/best-fit")
    public ResponseEntity<?> getBestFit(@PathVariable @NotBlank String name,
                                        @PathVariable String kind,
                                        @RequestParam @Min(0) int numInputs,
                                        @RequestParam @Min(0) int numOutputs) {
        log.info("Best fit lookup in {} for {} keys of size ({}, {})", name, kind, numInputs, numOutputs);
        return handle(name, () -> {
            BestFit<TransactionVerifyingKey> result =
                    keySetService.bestFitVerifyingKey(name, KeyKind.fromName(kind), numInputs, numOutputs);
            return result.match(
                    found -> ResponseEntity.ok(BestFitResponse.found(found.getSize(), found.getKey())),
                    notFound -> ResponseEntity.unprocessableEntity().body(BestFitResponse.notFound(notFound.getMaxSize())));
        });
    }

    private ResponseEntity<?> handle(String name, Lookup lookup) {
        try {
            return lookup.run();
        } catch (KeySetNotFoundException e) {
            log.warn(e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("Bad key set request for {}: {}", name, e.getMessage());
            return ResponseEntity.badRequest().body(e.getMessage());
        } catch (Exception e) {
            log.error("Key set lookup failed for {}", name, e);
            return ResponseEntity.internalServerError().body("Error looking up key set: " + e.getMessage());
        }
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<?> handleConstraintViolation(ConstraintViolationException e) {
        log.warn("Rejected key set request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(e.getMessage());
    }

    @FunctionalInterface
    private interface Lookup {
        ResponseEntity<?> run();
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class CommitmentResponse {
        private String name;
        private String commitment;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class BestFitResponse {
        private boolean found;
        private KeySize size;
        private KeySize maxSize;
        private TransactionVerifyingKey key;

        static BestFitResponse found(KeySize size, TransactionVerifyingKey key) {
            return new BestFitResponse(true, size, null, key);
        }

        static BestFitResponse notFound(KeySize maxSize) {
            return new BestFitResponse(false, null, maxSize, null);
        }
    }

}
