/*
 *  Copyright 2016 esbtools Contributors and/or its affiliates.
 *
 *  This file is part of esbtools.
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.esbtools.templatestore;

import org.esbtools.templatestore.tree.Patch;
import org.esbtools.templatestore.tree.Trees;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A document with a live content tree and the reverse deltas needed to reconstruct each of its
 * earlier versions.
 *
 * <p>The delta log always holds exactly {@code version - 1} patches. The patch at index
 * {@code i} turns the content of version {@code i + 2} into the content of version
 * {@code i + 1}. Instances are not thread safe; the {@link DocumentService} never shares a
 * document while it is being changed.
 */
public abstract class VersionedDocument {
    private String uuid;
    private String slug;
    private String domain;
    private DocumentKind kind;
    private int version = 1;
    private ObjectNode content = Trees.NODES.objectNode();
    private final List<Patch> reverseDeltas = new ArrayList<>();
    private final List<Reference> references = new ArrayList<>();

    protected VersionedDocument(String slug, String domain, DocumentKind kind) {
        this.uuid = UUID.randomUUID().toString();
        this.slug = Objects.requireNonNull(slug, "slug");
        this.domain = Objects.requireNonNull(domain, "domain");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    protected VersionedDocument(VersionedDocument toCopy) {
        this.uuid = toCopy.uuid;
        this.slug = toCopy.slug;
        this.domain = toCopy.domain;
        this.kind = toCopy.kind;
        this.version = toCopy.version;
        this.content = toCopy.content.deepCopy();
        this.reverseDeltas.addAll(toCopy.reverseDeltas);
        this.references.addAll(toCopy.references);
    }

    /**
     * A deep copy which may be changed without affecting this document.
     */
    public abstract VersionedDocument copy();

    public String getUuid() {
        return uuid;
    }

    public void setUuid(String uuid) {
        this.uuid = Objects.requireNonNull(uuid, "uuid");
    }

    public String getSlug() {
        return slug;
    }

    public String getDomain() {
        return domain;
    }

    public void setDomain(String domain) {
        this.domain = Objects.requireNonNull(domain, "domain");
    }

    public DocumentKind getKind() {
        return kind;
    }

    public int getVersion() {
        return version;
    }

    /**
     * Restores persisted history. The delta log must already agree with {@code version}.
     */
    public void restoreHistory(int version, List<Patch> reverseDeltas) {
        if (version < 1) {
            throw new IllegalArgumentException("Version must be at least 1 but was " + version);
        }
        if (reverseDeltas.size() != version - 1) {
            throw new IllegalArgumentException("Document " + slug + " at version " + version +
                    " needs " + (version - 1) + " reverse deltas but got " + reverseDeltas.size());
        }
        this.version = version;
        this.reverseDeltas.clear();
        this.reverseDeltas.addAll(reverseDeltas);
    }

    /**
     * @return A copy of the live content.
     */
    public ObjectNode getContent() {
        return content.deepCopy();
    }

    public void setContent(ObjectNode content) {
        this.content = Objects.requireNonNull(content, "content").deepCopy();
    }

    public List<Patch> getReverseDeltas() {
        return Collections.unmodifiableList(reverseDeltas);
    }

    /**
     * Records a new version: the live content moves on and {@code reverseDelta} leads back to the
     * content being replaced.
     */
    public void appendVersion(Patch reverseDelta) {
        reverseDeltas.add(Objects.requireNonNull(reverseDelta, "reverseDelta"));
        version++;
    }

    /**
     * Swaps the newest reverse delta, keeping the version. Used when nobody depends on the
     * current version so its history does not need to grow.
     */
    public void replaceLastReverseDelta(Patch reverseDelta) {
        if (reverseDeltas.isEmpty()) {
            throw new IllegalStateException("Document " + slug + " has no reverse delta to replace");
        }
        reverseDeltas.remove(reverseDeltas.size() - 1);
        reverseDeltas.add(Objects.requireNonNull(reverseDelta, "reverseDelta"));
    }

    /**
     * Drops the newest version. Content stays as is and becomes the previous version.
     */
    public Patch dropLastVersion() {
        if (reverseDeltas.isEmpty()) {
            throw new IllegalStateException("Document " + slug + " is at version 1");
        }
        version--;
        return reverseDeltas.remove(reverseDeltas.size() - 1);
    }

    public List<Reference> getReferences() {
        return Collections.unmodifiableList(references);
    }

    public void setReferences(List<Reference> references) {
        this.references.clear();
        this.references.addAll(references);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "slug='" + slug + '\'' +
                ", domain='" + domain + '\'' +
                ", kind=" + kind.wireName() +
                ", version=" + version +
                ", uuid='" + uuid + '\'' +
                '}';
    }
}
