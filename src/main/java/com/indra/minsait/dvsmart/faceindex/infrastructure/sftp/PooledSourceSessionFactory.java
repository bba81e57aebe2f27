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
package com.indra.minsait.dvsmart.faceindex.infrastructure.sftp;

import com.indra.minsait.dvsmart.faceindex.infrastructure.config.SftpConfigProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPool;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.apache.sshd.sftp.client.SftpClient;
import org.springframework.integration.file.remote.session.Session;
import org.springframework.integration.file.remote.session.SessionFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 14-01-2026 at 10:25:03
 * File: PooledSourceSessionFactory.java
 */

/**
 * SessionFactory con pool lazy (commons-pool2) para el origen de fotos.
 * 
 * Las sesiones se crean bajo demanda y se devuelven al pool al cerrarse,
 * de modo que los workers de indexación comparten un número acotado de conexiones.
 */
@Slf4j
public class PooledSourceSessionFactory implements SessionFactory<SftpClient.DirEntry> {

    private final GenericObjectPool<Session<SftpClient.DirEntry>> pool;
    private final AtomicLong borrows = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public PooledSourceSessionFactory(SessionFactory<SftpClient.DirEntry> targetFactory,
                                      String probePath,
                                      SftpConfigProperties.Pool poolProps) {

        GenericObjectPoolConfig<Session<SftpClient.DirEntry>> config = new GenericObjectPoolConfig<>();
        config.setMaxTotal(poolProps.getMaxSize());
        config.setMaxIdle(poolProps.getMaxSize());
        config.setMinIdle(0);
        config.setLifo(true);
        config.setMaxWait(Duration.ofMillis(poolProps.getMaxWaitMillis()));
        config.setTestOnBorrow(poolProps.isTestOnBorrow());
        config.setTestWhileIdle(true);
        config.setTimeBetweenEvictionRuns(Duration.ofMillis(poolProps.getTimeBetweenEvictionRunsMillis()));
        config.setMinEvictableIdleTime(Duration.ofMillis(poolProps.getMinEvictableIdleTimeMillis()));

        this.pool = new GenericObjectPool<>(new SftpSessionPooledObjectFactory(targetFactory, probePath), config);

        for (int i = 0; i < poolProps.getInitialSize(); i++) {
            try {
                pool.addObject();
            } catch (Exception e) {
                log.warn("⚠️  Could not pre-open SFTP session {}: {}", i, e.getMessage());
            }
        }

        log.info("SFTP source pool ready: maxSize={}, initialSize={}", poolProps.getMaxSize(), poolProps.getInitialSize());
    }

    @Override
    public Session<SftpClient.DirEntry> getSession() {
        try {
            Session<SftpClient.DirEntry> session = pool.borrowObject();
            borrows.incrementAndGet();
            return new ReturningSession(session);
        } catch (Exception e) {
            failures.incrementAndGet();
            throw new IllegalStateException("Could not obtain SFTP session from pool", e);
        }
    }

    public PoolStats getStats() {
        return new PoolStats(
            pool.getNumActive(),
            pool.getNumIdle(),
            pool.getMaxTotal(),
            pool.getCreatedCount(),
            pool.getDestroyedCount(),
            borrows.get(),
            failures.get()
        );
    }

    public void destroy() {
        log.info("Closing SFTP source pool...");
        pool.close();
    }

    public record PoolStats(
        int active,
        int idle,
        int maxTotal,
        long created,
        long destroyed,
        long borrows,
        long failures
    ) {
        public double utilizationPercent() {
            return maxTotal == 0 ? 0.0 : (double) active / maxTotal * 100.0;
        }
    }

    /**
     * Sesión prestada: close() la devuelve al pool en lugar de cerrarla.
     */
    private final class ReturningSession implements Session<SftpClient.DirEntry> {

        private final Session<SftpClient.DirEntry> delegate;
        private volatile boolean returned;

        private ReturningSession(Session<SftpClient.DirEntry> delegate) {
            this.delegate = delegate;
        }

        @Override
        public void close() {
            if (returned) {
                return;
            }
            returned = true;
            if (delegate.isOpen()) {
                pool.returnObject(delegate);
            } else {
                try {
                    pool.invalidateObject(delegate);
                } catch (Exception e) {
                    log.warn("Could not invalidate broken SFTP session: {}", e.getMessage());
                }
            }
        }

        @Override
        public boolean isOpen() {
            return !returned && delegate.isOpen();
        }

        @Override
        public SftpClient.DirEntry[] list(String path) throws IOException {
            return delegate.list(path);
        }

        @Override
        public String[] listNames(String path) throws IOException {
            return delegate.listNames(path);
        }

        @Override
        public void read(String source, OutputStream outputStream) throws IOException {
            delegate.read(source, outputStream);
        }

        @Override
        public InputStream readRaw(String source) throws IOException {
            return delegate.readRaw(source);
        }

        @Override
        public boolean finalizeRaw() throws IOException {
            return delegate.finalizeRaw();
        }

        @Override
        public boolean exists(String path) throws IOException {
            return delegate.exists(path);
        }

        @Override
        public void write(InputStream inputStream, String destination) throws IOException {
            delegate.write(inputStream, destination);
        }

        @Override
        public void append(InputStream inputStream, String destination) throws IOException {
            delegate.append(inputStream, destination);
        }

        @Override
        public boolean remove(String path) throws IOException {
            return delegate.remove(path);
        }

        @Override
        public boolean mkdir(String directory) throws IOException {
            return delegate.mkdir(directory);
        }

        @Override
        public boolean rmdir(String directory) throws IOException {
            return delegate.rmdir(directory);
        }

        @Override
        public void rename(String pathFrom, String pathTo) throws IOException {
            delegate.rename(pathFrom, pathTo);
        }

        @Override
        public Object getClientInstance() {
            return delegate.getClientInstance();
        }

        @Override
        public String getHostPort() {
            return delegate.getHostPort();
        }
    }
}
