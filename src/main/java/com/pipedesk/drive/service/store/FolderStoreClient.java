package com.pipedesk.drive.service.store;

import com.pipedesk.drive.exception.StoreUnavailableException;
import com.pipedesk.drive.exception.StoreWriteOutcomeUnknownException;
import com.pipedesk.drive.model.store.StoreItem;

import java.util.List;

/**
 * Operations every external document store adapter provides. None of them is idempotent:
 * two {@link #createFolder} calls with the same name and parent create two folders.
 *
 * <p>Read failures raise {@link StoreUnavailableException}. Write failures whose outcome cannot be
 * known (timeouts, dropped connections) raise {@link StoreWriteOutcomeUnknownException}.
 */
public interface FolderStoreClient {

    StoreItem createFolder(String name, String parentId);

    List<StoreItem> listChildren(String folderId);

    StoreItem createFile(byte[] content, String name, String mimeType, String parentId);

    /**
     * @return the item, or null when the store does not know it
     */
    StoreItem getItem(String itemId);

    StoreItem renameItem(String itemId, String newName);
}
