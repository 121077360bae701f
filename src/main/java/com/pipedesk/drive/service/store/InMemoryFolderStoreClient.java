package com.pipedesk.drive.service.store;

import com.pipedesk.drive.enums.StoreItemTypeEnum;
import com.pipedesk.drive.exception.StoreUnavailableException;
import com.pipedesk.drive.exception.ValidationException;
import com.pipedesk.drive.model.store.StoreItem;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local stand-in for the document store. Items live in a map keyed by id; a listing is a
 * scan over the items whose parents contain the folder.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "pipedesk.drive.store.mode", havingValue = "memory", matchIfMissing = true)
public class InMemoryFolderStoreClient implements FolderStoreClient {

    private static final String URL_TEMPLATE = "https://mock-drive.local/%s/%s";

    private final Map<String, StoreItem> items = new ConcurrentHashMap<>();

    // insertion sequence per item id, listings are returned in creation order
    private final Map<String, Long> creationOrder = new ConcurrentHashMap<>();

    private final AtomicLong sequence = new AtomicLong();

    private final String rootFolderId;

    public InMemoryFolderStoreClient(@Value("${pipedesk.drive.root-folder-id:root}") String rootFolderId) {
        this.rootFolderId = rootFolderId;
        this.reset();
    }

    @Override
    public StoreItem createFolder(String name, String parentId) {
        if (StringUtils.isAnyBlank(name, parentId)) {
            throw new ValidationException("createFolder failed. name or parentId is blank. " +
                    "name is %s, parentId is %s".formatted(name, parentId));
        }
        this.checkParent(parentId);
        String folderId = UUID.randomUUID().toString();
        StoreItem folder = StoreItem.builder()
                .id(folderId)
                .name(name)
                .type(StoreItemTypeEnum.FOLDER)
                .mimeType(StoreItemTypeEnum.FOLDER.getMimeType())
                .url(URL_TEMPLATE.formatted("folders", folderId))
                .createdAt(Instant.now())
                .parents(List.of(parentId))
                .build();
        this.put(folder);
        return folder.toBuilder().build();
    }

    @Override
    public List<StoreItem> listChildren(String folderId) {
        if (StringUtils.isBlank(folderId)) {
            throw new ValidationException("listChildren failed. folderId is blank");
        }
        List<StoreItem> result = new ArrayList<>();
        for (StoreItem item : this.items.values()) {
            if (item.getParents().contains(folderId) && !item.isTrashed()) {
                result.add(item.toBuilder().build());
            }
        }
        result.sort(Comparator.comparing(item -> this.creationOrder.getOrDefault(item.getId(), 0L)));
        return result;
    }

    @Override
    public StoreItem createFile(byte[] content, String name, String mimeType, String parentId) {
        if (ObjectUtils.isEmpty(content) || StringUtils.isAnyBlank(name, parentId)) {
            throw new ValidationException("createFile failed. content, name or parentId is empty. " +
                    "name is %s, parentId is %s".formatted(name, parentId));
        }
        this.checkParent(parentId);
        String fileId = UUID.randomUUID().toString();
        StoreItem file = StoreItem.builder()
                .id(fileId)
                .name(name)
                .type(StoreItemTypeEnum.FILE)
                .mimeType(StringUtils.defaultIfBlank(mimeType, "application/octet-stream"))
                .url(URL_TEMPLATE.formatted("files", fileId))
                .size((long) content.length)
                .createdAt(Instant.now())
                .parents(List.of(parentId))
                .build();
        this.put(file);
        return file.toBuilder().build();
    }

    @Override
    public StoreItem getItem(String itemId) {
        if (StringUtils.isBlank(itemId)) {
            throw new ValidationException("getItem failed. itemId is blank");
        }
        StoreItem item = this.items.get(itemId);
        return ObjectUtils.isEmpty(item) ? null : item.toBuilder().build();
    }

    @Override
    public StoreItem renameItem(String itemId, String newName) {
        if (StringUtils.isAnyBlank(itemId, newName)) {
            throw new ValidationException("renameItem failed. itemId or newName is blank");
        }
        StoreItem renamed = this.items.computeIfPresent(
                itemId,
                (id, item) -> item.toBuilder().name(newName).build());
        if (ObjectUtils.isEmpty(renamed)) {
            throw new StoreUnavailableException("renameItem failed. item %s does not exist".formatted(itemId));
        }
        return renamed.toBuilder().build();
    }

    // deletion behind the service's back, as a user would do in the store's own UI
    public boolean removeItem(String itemId) {
        StoreItem removed = this.items.remove(itemId);
        this.creationOrder.remove(itemId);
        if (ObjectUtils.isEmpty(removed)) {
            return false;
        }
        log.info("removed item {} ({}) from in-memory store", itemId, removed.getName());
        return true;
    }

    // moves an item to the trash behind the service's back, it disappears from listings
    public boolean trashItem(String itemId) {
        StoreItem trashed = this.items.computeIfPresent(
                itemId,
                (id, item) -> item.toBuilder().trashed(true).build());
        if (ObjectUtils.isEmpty(trashed)) {
            return false;
        }
        log.info("trashed item {} ({}) in in-memory store", itemId, trashed.getName());
        return true;
    }

    public void reset() {
        this.items.clear();
        this.creationOrder.clear();
        this.put(StoreItem.builder()
                .id(this.rootFolderId)
                .name("My Drive")
                .type(StoreItemTypeEnum.FOLDER)
                .mimeType(StoreItemTypeEnum.FOLDER.getMimeType())
                .createdAt(Instant.now())
                .parents(List.of())
                .build());
    }

    public int countItems() {
        return this.items.size();
    }

    private void put(StoreItem item) {
        this.creationOrder.put(item.getId(), this.sequence.incrementAndGet());
        this.items.put(item.getId(), item);
    }

    private void checkParent(String parentId) {
        StoreItem parent = this.items.get(parentId);
        if (ObjectUtils.isEmpty(parent) || !parent.isFolder()) {
            throw new StoreUnavailableException("parent folder %s does not exist".formatted(parentId));
        }
    }
}
