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
package com.indra.minsait.dvsmart.faceindex.adapter.out.source;

import com.indra.minsait.dvsmart.faceindex.domain.exception.SourceListingException;
import com.indra.minsait.dvsmart.faceindex.domain.model.SourceFile;
import com.indra.minsait.dvsmart.faceindex.infrastructure.config.FaceIndexProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocalFolderSourceListingAdapterTest {

    @TempDir
    Path root;

    private FaceIndexProperties props;

    @BeforeEach
    void setUp() {
        props = new FaceIndexProperties();
        props.getSource().getLocal().setRootDir(root.toString());
    }

    private void write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private static List<String> ids(List<SourceFile> files) {
        return files.stream().map(SourceFile::getId).sorted().toList();
    }

    @Test
    void listsNestedFilesWithStableIds() throws IOException {
        write("alice/album/a.jpg", "a");
        write("alice/album/2024/b.png", "bb");
        write("alice/other/c.jpg", "c");

        List<SourceFile> files = new LocalFolderSourceListingAdapter(props).list("alice/album");

        assertEquals(List.of("alice/album/2024/b.png", "alice/album/a.jpg"), ids(files));
        SourceFile b = files.stream().filter(f -> f.getFileName().equals("b.png")).findFirst().orElseThrow();
        assertEquals(2, b.getSize());
        assertTrue(b.getModificationTime() > 0);
    }

    @Test
    void hiddenDirectoriesAreNotDescended() throws IOException {
        write("album/a.jpg", "a");
        write("album/.thumbnails/a.jpg", "t");
        write("album/sub/.cache/x.jpg", "x");

        List<SourceFile> files = new LocalFolderSourceListingAdapter(props).list("album");

        assertEquals(List.of("album/a.jpg"), ids(files));
    }

    @Test
    void depthIsLimited() throws IOException {
        props.getProcessing().setMaxDepth(1);
        write("album/a.jpg", "a");
        write("album/l1/b.jpg", "b");
        write("album/l1/l2/c.jpg", "c");

        List<SourceFile> files = new LocalFolderSourceListingAdapter(props).list("album");

        assertEquals(List.of("album/a.jpg", "album/l1/b.jpg"), ids(files));
    }

    @Test
    void leadingSlashIsRelativeToRoot() throws IOException {
        write("album/a.jpg", "a");

        assertEquals(1, new LocalFolderSourceListingAdapter(props).list("/album").size());
    }

    @Test
    void missingFolderFailsListing() {
        LocalFolderSourceListingAdapter adapter = new LocalFolderSourceListingAdapter(props);

        assertThrows(SourceListingException.class, () -> adapter.list("does-not-exist"));
    }

    @Test
    void scopeCannotEscapeRoot() {
        LocalFolderSourceListingAdapter adapter = new LocalFolderSourceListingAdapter(props);

        assertThrows(IllegalArgumentException.class, () -> adapter.list("../.."));
        assertThrows(IllegalArgumentException.class, () -> adapter.list("album/../../etc"));
    }

    @Test
    void downloadCopiesFileContent() throws IOException {
        write("album/a.jpg", "image-bytes");
        LocalFolderSourceListingAdapter adapter = new LocalFolderSourceListingAdapter(props);
        SourceFile file = adapter.list("album").get(0);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        adapter.download(file, out);

        assertEquals("image-bytes", out.toString(StandardCharsets.UTF_8));
        assertEquals("local", adapter.sourceType());
    }
}
