/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.rms.server;

import ru.nts.tools.rms.core.CancellationToken;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Открытые в редакторе документы и токены отмены их текущих проверок.
 */
final class DocumentStore {

    record Document(String uri, String text, int version, CancellationToken check) {
    }

    private final Map<String, Document> documents = new ConcurrentHashMap<>();

    /**
     * Сохраняет новую версию текста. Проверка предыдущей версии отменяется.
     *
     * @return документ с новым токеном отмены
     */
    Document update(String uri, String text, int version) {
        Document next = new Document(uri, text, version, new CancellationToken());
        Document previous = documents.put(uri, next);
        if (previous != null) {
            previous.check().cancel();
        }
        return next;
    }

    Optional<Document> get(String uri) {
        return Optional.ofNullable(documents.get(uri));
    }

    /**
     * Документ всё ещё актуален (не заменён новой версией и не закрыт).
     */
    boolean isCurrent(Document document) {
        return documents.get(document.uri()) == document;
    }

    void close(String uri) {
        Document removed = documents.remove(uri);
        if (removed != null) {
            removed.check().cancel();
        }
    }
}
