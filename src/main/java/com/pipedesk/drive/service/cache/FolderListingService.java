package com.pipedesk.drive.service.cache;

import com.pipedesk.drive.exception.StoreUnavailableException;
import com.pipedesk.drive.exception.ValidationException;
import com.pipedesk.drive.model.store.StoreItem;
import com.pipedesk.drive.service.store.FolderStoreClient;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;

/**
 * Store access for the hierarchy engine. Child listings are cached under
 * {@code drive:list_files:<folderId>}; every write under a folder drops that folder's entry.
 */
@Slf4j
@Service
public class FolderListingService {

    public static final String LIST_FILES_KEY_PREFIX = "drive:list_files:";

    private final FolderStoreClient folderStoreClient;

    private final JsonCacheService jsonCacheService;

    @Autowired
    public FolderListingService(FolderStoreClient folderStoreClient, JsonCacheService jsonCacheService) {
        this.folderStoreClient = folderStoreClient;
        this.jsonCacheService = jsonCacheService;
    }

    public static String listFilesKey(String folderId) {
        return LIST_FILES_KEY_PREFIX + folderId;
    }

    public List<StoreItem> listChildren(String folderId) {
        if (StringUtils.isBlank(folderId)) {
            throw new ValidationException("listChildren failed. folderId is blank");
        }
        List<StoreItem> cacheResult = this.jsonCacheService.getList(listFilesKey(folderId), StoreItem.class);
        if (ObjectUtils.isNotEmpty(cacheResult)) {
            return cacheResult;
        }
        // miss or cache failure, ask the store directly
        return this.listChildrenFresh(folderId);
    }

    // bypasses the cache, used where a stale listing would hide an out-of-band deletion
    public List<StoreItem> listChildrenFresh(String folderId) {
        if (StringUtils.isBlank(folderId)) {
            throw new ValidationException("listChildrenFresh failed. folderId is blank");
        }
        List<StoreItem> storeResult = this.folderStoreClient.listChildren(folderId);
        if (CollectionUtils.isEmpty(storeResult)) {
            this.jsonCacheService.invalidate(listFilesKey(folderId));
            return Collections.emptyList();
        }
        this.jsonCacheService.set(listFilesKey(folderId), storeResult);
        return storeResult;
    }

    /**
     * Finds a child folder by display name. Names are compared after trimming; the first match in
     * listing order wins. Trashed folders never match.
     *
     * @return the folder, or null when none matches
     */
    public StoreItem findChildFolder(String parentId, String folderName, boolean fresh) {
        if (StringUtils.isAnyBlank(parentId, folderName)) {
            throw new ValidationException("findChildFolder failed. parentId or folderName is blank. " +
                    "parentId is %s, folderName is %s".formatted(parentId, folderName));
        }
        List<StoreItem> children = fresh ? this.listChildrenFresh(parentId) : this.listChildren(parentId);
        return findFolderByName(children, folderName);
    }

    public StoreItem createFolder(String folderName, String parentId) {
        try {
            StoreItem folder = this.folderStoreClient.createFolder(folderName, parentId);
            if (ObjectUtils.isEmpty(folder) || StringUtils.isBlank(folder.getId())) {
                throw new StoreUnavailableException(("createFolder failed. store returned no folder. " +
                        "folderName is %s, parentId is %s").formatted(folderName, parentId));
            }
            log.info("created folder '{}' ({}) in {}", folderName, folder.getId(), parentId);
            return folder;
        } finally {
            // also after a failed write, the folder may exist anyway
            this.jsonCacheService.invalidate(listFilesKey(parentId));
        }
    }

    public StoreItem createFile(byte[] content, String fileName, String mimeType, String parentId) {
        try {
            StoreItem file = this.folderStoreClient.createFile(content, fileName, mimeType, parentId);
            if (ObjectUtils.isEmpty(file) || StringUtils.isBlank(file.getId())) {
                throw new StoreUnavailableException(("createFile failed. store returned no file. " +
                        "fileName is %s, parentId is %s").formatted(fileName, parentId));
            }
            log.info("created file '{}' ({}) in {}", fileName, file.getId(), parentId);
            return file;
        } finally {
            this.jsonCacheService.invalidate(listFilesKey(parentId));
        }
    }

    public StoreItem renameItem(String itemId, String newName) {
        StoreItem before = this.folderStoreClient.getItem(itemId);
        try {
            return this.folderStoreClient.renameItem(itemId, newName);
        } finally {
            if (ObjectUtils.isNotEmpty(before) && CollectionUtils.isNotEmpty(before.getParents())) {
                for (String parentId : before.getParents()) {
                    this.jsonCacheService.invalidate(listFilesKey(parentId));
                }
            }
        }
    }

    public StoreItem getItem(String itemId) {
        return this.folderStoreClient.getItem(itemId);
    }

    static StoreItem findFolderByName(List<StoreItem> children, String folderName) {
        if (CollectionUtils.isEmpty(children)) {
            return null;
        }
        String target = folderName.trim();
        for (StoreItem child : children) {
            if (child.isFolder()
                    && !child.isTrashed()
                    && StringUtils.isNotEmpty(child.getName())
                    && target.equals(child.getName().trim())) {
                return child;
            }
        }
        return null;
    }
}
