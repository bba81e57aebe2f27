/*
 * /////////////////////////////////////////////////////////////////////////////
 *
 * Copyright (c) 2026 Indra Sistemas, S.A. All Rights Reserved.
 * http://www.indracompany.com/
 *
 * The contents of this file are owned by Indra Sistemas, S.A. copyright holder.
 * This file can only be copied, distributed and used all or in part with the
 * written permission of Indra Sistemas, S.A, or in accordance with the terms and
 * conditions laid down in the agreement / contract under which supplied.
 *
 * /////////////////////////////////////////////////////////////////////////////
 */
package com.indra.minsait.dvsmart.faceindex.domain.service;

import com.indra.minsait.dvsmart.faceindex.application.port.out.LocalEmbeddingStorePort;
import com.indra.minsait.dvsmart.faceindex.application.port.out.RemoteEmbeddingStorePort;
import com.indra.minsait.dvsmart.faceindex.domain.exception.LocalStoreException;
import com.indra.minsait.dvsmart.faceindex.domain.exception.LocalStoreUnavailableException;
import com.indra.minsait.dvsmart.faceindex.domain.exception.RemoteStoreException;
import com.indra.minsait.dvsmart.faceindex.domain.model.PhotoEmbeddingSet;
import com.indra.minsait.dvsmart.faceindex.domain.model.ReconciliationReport;
import com.indra.minsait.dvsmart.faceindex.domain.model.StorePut;
import com.indra.minsait.dvsmart.faceindex.domain.model.StoreStats;
import com.indra.minsait.dvsmart.faceindex.domain.model.StoreTier;
import com.indra.minsait.dvsmart.faceindex.domain.model.TierRead;
import com.indra.minsait.dvsmart.faceindex.infrastructure.config.FaceIndexProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import java.util.List;
import java.util.Optional;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 15-01-2026 at 11:20:09
 * File: EmbeddingStoreService.java
 */

/**
 * Almacén de embeddings en dos niveles.
 *
 * <ul>
 *   <li>Escritura: nivel local síncrono (autoritativo); nivel remoto a continuación,
 *       cuyo fallo no es fatal y deja el conjunto pendiente de reconciliar.</li>
 *   <li>Lectura: primero local; si falla, remoto y relleno del local.</li>
 * </ul>
 *
 * Consistencia eventual entre niveles: el local siempre está al menos tan
 * actualizado como el remoto. No hay transacción distribuida; los conjuntos se
 * reescriben completos y de forma idempotente.
 */
@Slf4j
@Service
public class EmbeddingStoreService {

    private final LocalEmbeddingStorePort local;
    private final RemoteEmbeddingStorePort remote;
    private final boolean warmLocalOnFallback;

    public EmbeddingStoreService(
            LocalEmbeddingStorePort local,
            RemoteEmbeddingStorePort remote,
            FaceIndexProperties props) {
        this.local = local;
        this.remote = remote;
        this.warmLocalOnFallback = props.getSearch().isWarmLocalOnFallback();
    }

    /**
     * Indica si la foto ya tiene embeddings (también un conjunto vacío).
     * Si solo está en el remoto, se rellena el local.
     */
    public boolean exists(String owner, String photoReference) {
        if (local.exists(owner, photoReference)) {
            return true;
        }
        Optional<PhotoEmbeddingSet> fromRemote = readRemote(owner, photoReference);
        fromRemote.ifPresent(this::backfill);
        return fromRemote.isPresent();
    }

    /**
     * Escribe el conjunto de la foto.
     *
     * @param replace si es false y la foto ya está en el nivel local, no se escribe nada
     * @throws LocalStoreException si falla la escritura local
     */
    public StorePut put(PhotoEmbeddingSet set, boolean replace) {
        String owner = set.getOwner();
        String photoReference = set.getPhotoReference();

        if (!replace && local.exists(owner, photoReference)) {
            log.debug("Embeddings already stored, not replacing: {}/{}", owner, photoReference);
            return StorePut.UNCHANGED;
        }

        PhotoEmbeddingSet pending = set.withRemoteSynced(false);
        local.replace(pending);

        try {
            remote.upsert(pending);
        } catch (RemoteStoreException e) {
            log.warn("⚠️ Remote tier write failed for {}/{}, pending reconciliation: {}",
                    owner, photoReference, e.getMessage());
            return new StorePut(true, false);
        }

        try {
            if (!local.markRemoteSynced(owner, photoReference, pending.getUpdatedAt())) {
                log.debug("{}/{} replaced while syncing, left pending", owner, photoReference);
            }
        } catch (LocalStoreUnavailableException e) {
            throw e;
        } catch (LocalStoreException e) {
            // El remoto ya tiene el dato; la reconciliación lo volverá a subir
            log.warn("⚠️ Could not mark {}/{} as synced: {}", owner, photoReference, e.getMessage());
            return new StorePut(true, false);
        }
        return new StorePut(true, true);
    }

    public Optional<PhotoEmbeddingSet> get(String owner, String photoReference) {
        Optional<PhotoEmbeddingSet> fromLocal = local.find(owner, photoReference);
        if (fromLocal.isPresent()) {
            return fromLocal;
        }
        Optional<PhotoEmbeddingSet> fromRemote = readRemote(owner, photoReference);
        fromRemote.ifPresent(this::backfill);
        return fromRemote;
    }

    public List<PhotoEmbeddingSet> getAll(String owner) {
        return readAll(owner).sets();
    }

    /**
     * Corpus completo de un propietario: nivel local si tiene datos, si no el
     * remoto (calentando el local si está configurado).
     */
    public TierRead readAll(String owner) {
        List<PhotoEmbeddingSet> fromLocal = local.findAll(owner);
        if (!fromLocal.isEmpty()) {
            return new TierRead(StoreTier.LOCAL, fromLocal);
        }

        List<PhotoEmbeddingSet> fromRemote;
        try {
            fromRemote = remote.findAll(owner);
        } catch (RemoteStoreException e) {
            log.warn("⚠️ Remote tier unavailable while reading corpus of {}: {}", owner, e.getMessage());
            return new TierRead(StoreTier.LOCAL, List.of());
        }

        if (fromRemote.isEmpty()) {
            return new TierRead(StoreTier.LOCAL, List.of());
        }

        log.info("Local tier empty for {}, using remote tier ({} photos)", owner, fromRemote.size());
        if (warmLocalOnFallback) {
            fromRemote.forEach(this::backfill);
            log.info("Local tier warmed for {} with {} photos", owner, fromRemote.size());
        }
        return new TierRead(StoreTier.REMOTE, fromRemote);
    }

    /**
     * Borra los embeddings de una foto en ambos niveles.
     *
     * @return true si existía en alguno de los dos
     */
    public boolean delete(String owner, String photoReference) {
        boolean deletedLocal = local.delete(owner, photoReference);
        boolean deletedRemote = false;
        try {
            deletedRemote = remote.delete(owner, photoReference);
        } catch (RemoteStoreException e) {
            log.warn("⚠️ Remote tier delete failed for {}/{}: {}", owner, photoReference, e.getMessage());
        }
        log.info("Deleted embeddings {}/{} (local={}, remote={})", owner, photoReference, deletedLocal, deletedRemote);
        return deletedLocal || deletedRemote;
    }

    /**
     * Sube al remoto los conjuntos que solo están en el local. Primero en bloque;
     * si el bloque falla, uno a uno para aislar los que no se pueden subir.
     */
    public ReconciliationReport reconcile(int batchSize) {
        List<PhotoEmbeddingSet> pending = local.findPendingRemoteSync(batchSize);
        if (pending.isEmpty()) {
            return new ReconciliationReport(0, 0, 0);
        }

        List<PhotoEmbeddingSet> synced = pending.stream().map(set -> set.withRemoteSynced(true)).toList();
        int pushed = 0;
        int failed = 0;

        try {
            remote.upsertAll(synced);
            for (PhotoEmbeddingSet set : synced) {
                markSynced(set);
            }
            pushed = synced.size();
        } catch (RemoteStoreException bulkError) {
            log.warn("⚠️ Bulk reconciliation failed, retrying one by one: {}", bulkError.getMessage());
            for (PhotoEmbeddingSet set : synced) {
                try {
                    remote.upsert(set);
                    markSynced(set);
                    pushed++;
                } catch (RemoteStoreException e) {
                    failed++;
                    log.warn("⚠️ Reconciliation failed for {}/{}: {}", set.getOwner(), set.getPhotoReference(), e.getMessage());
                }
            }
        }

        log.info("Reconciliation: pending={}, pushed={}, failed={}", pending.size(), pushed, failed);
        return new ReconciliationReport(pending.size(), pushed, failed);
    }

    // Un conjunto sustituido durante la subida sigue pendiente para la próxima pasada
    private void markSynced(PhotoEmbeddingSet set) {
        if (!local.markRemoteSynced(set.getOwner(), set.getPhotoReference(), set.getUpdatedAt())) {
            log.info("{}/{} changed during reconciliation, stays pending", set.getOwner(), set.getPhotoReference());
        }
    }

    public StoreStats stats(String owner) {
        return local.stats(owner);
    }

    private Optional<PhotoEmbeddingSet> readRemote(String owner, String photoReference) {
        try {
            return remote.find(owner, photoReference);
        } catch (RemoteStoreException e) {
            log.debug("Remote tier lookup failed for {}/{}: {}", owner, photoReference, e.getMessage());
            return Optional.empty();
        }
    }

    private void backfill(PhotoEmbeddingSet set) {
        try {
            local.replace(set.withRemoteSynced(true));
        } catch (LocalStoreUnavailableException e) {
            throw e;
        } catch (LocalStoreException e) {
            log.warn("⚠️ Could not backfill local tier with {}/{}: {}", set.getOwner(), set.getPhotoReference(), e.getMessage());
        }
    }
}
