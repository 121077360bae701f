package com.pipedesk.drive.service.hierarchy;

import com.pipedesk.drive.enums.EntityTypeEnum;
import com.pipedesk.drive.exception.PipedeskDriveException;
import com.pipedesk.drive.exception.ValidationException;
import com.pipedesk.drive.model.entity.FolderTemplateEntity;
import com.pipedesk.drive.model.entity.FolderTemplateNodeEntity;
import com.pipedesk.drive.model.store.StoreItem;
import com.pipedesk.drive.service.cache.FolderListingService;
import com.pipedesk.drive.service.db.impl.FolderTemplateService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates the folder tree of the active template under an entity folder.
 *
 * <p>Every node is looked up by name among the target folder's existing child folders before it is
 * created, so applying a template again, after a partial failure or after a folder was removed,
 * only fills in what is missing.
 */
@Slf4j
@Service
public class TemplateMaterializerService {

    private static final Comparator<FolderTemplateNodeEntity> SIBLING_ORDER = Comparator
            .comparing((FolderTemplateNodeEntity node) -> ObjectUtils.defaultIfNull(node.getSortOrder(), 0))
            .thenComparing(FolderTemplateNodeEntity::getNodeId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final FolderTemplateService folderTemplateService;

    private final FolderListingService folderListingService;

    @Autowired
    public TemplateMaterializerService(
            FolderTemplateService folderTemplateService,
            FolderListingService folderListingService) {
        this.folderTemplateService = folderTemplateService;
        this.folderListingService = folderListingService;
    }

    public void applyTemplate(EntityTypeEnum entityType, String rootFolderId) {
        this.applyTemplate(entityType, rootFolderId, false);
    }

    /**
     * @param fresh list every target folder straight from the store instead of the cache
     * @return the number of folders created, 0 when nothing was missing or no template is active
     */
    public int applyTemplate(EntityTypeEnum entityType, String rootFolderId, boolean fresh) {
        if (ObjectUtils.isEmpty(entityType) || StringUtils.isBlank(rootFolderId)) {
            throw new ValidationException("applyTemplate failed. entityType or rootFolderId is empty. " +
                    "entityType is %s, rootFolderId is %s".formatted(entityType, rootFolderId));
        }
        FolderTemplateEntity template = this.folderTemplateService.getActiveTemplate(entityType);
        if (ObjectUtils.isEmpty(template)) {
            log.info("no active template for {}, nothing to apply under {}", entityType.getCode(), rootFolderId);
            return 0;
        }
        if (CollectionUtils.isEmpty(template.getNodes())) {
            log.info("template '{}' has no nodes", template.getTemplateName());
            return 0;
        }
        Map<Long, List<FolderTemplateNodeEntity>> childrenIndex = buildChildrenIndex(template.getNodes());
        MaterializeRun run = new MaterializeRun(fresh);
        this.materializeLevel(run, childrenIndex, null, rootFolderId);
        log.info("applied template '{}' under {}. created {} folders",
                template.getTemplateName(), rootFolderId, run.created.get());
        return run.created.get();
    }

    /**
     * Runs {@link #applyTemplate(EntityTypeEnum, String)} on the template worker pool. Failures are
     * logged only; the entity mapping already exists and a repair resumes the tree.
     */
    @Async("executor")
    public void applyTemplateInBackground(EntityTypeEnum entityType, String rootFolderId) {
        try {
            this.applyTemplate(entityType, rootFolderId, false);
        } catch (PipedeskDriveException e) {
            log.error("background template apply failed for {} under {}. repair is needed",
                    entityType.getCode(), rootFolderId, e);
        }
    }

    private void materializeLevel(
            MaterializeRun run,
            Map<Long, List<FolderTemplateNodeEntity>> childrenIndex,
            Long parentNodeId,
            String targetFolderId) {
        List<FolderTemplateNodeEntity> nodes = childrenIndex.getOrDefault(parentNodeId, Collections.emptyList());
        if (CollectionUtils.isEmpty(nodes)) {
            return;
        }
        Map<String, String> existing = run.childFolders(targetFolderId);
        for (FolderTemplateNodeEntity node : nodes) {
            String nodeName = StringUtils.trimToNull(node.getNodeName());
            if (ObjectUtils.isEmpty(nodeName)) {
                log.warn("skip template node {} without a name", node.getNodeId());
                continue;
            }
            String folderId = existing.get(nodeName);
            if (ObjectUtils.isEmpty(folderId)) {
                StoreItem created = this.folderListingService.createFolder(nodeName, targetFolderId);
                folderId = created.getId();
                existing.put(nodeName, folderId);
                run.created.incrementAndGet();
            }
            this.materializeLevel(run, childrenIndex, node.getNodeId(), folderId);
        }
    }

    // <parent node id, children in sibling order>, root nodes under the null key
    static Map<Long, List<FolderTemplateNodeEntity>> buildChildrenIndex(List<FolderTemplateNodeEntity> nodes) {
        Map<Long, List<FolderTemplateNodeEntity>> index = new HashMap<>();
        for (FolderTemplateNodeEntity node : nodes) {
            index.computeIfAbsent(node.getParentNodeId(), k -> new ArrayList<>()).add(node);
        }
        for (List<FolderTemplateNodeEntity> siblings : index.values()) {
            siblings.sort(SIBLING_ORDER);
        }
        return index;
    }

    // state of one application, never shared between calls
    private class MaterializeRun {

        private final boolean fresh;

        private final AtomicInteger created = new AtomicInteger(0);

        // <folder id, <trimmed child folder name, child folder id>>
        private final Map<String, Map<String, String>> childFolderCache = new HashMap<>();

        private MaterializeRun(boolean fresh) {
            this.fresh = fresh;
        }

        private Map<String, String> childFolders(String folderId) {
            if (this.childFolderCache.containsKey(folderId)) {
                return this.childFolderCache.get(folderId);
            }
            // a failed listing propagates, creating blind would duplicate folders
            List<StoreItem> children = this.fresh ?
                    folderListingService.listChildrenFresh(folderId) :
                    folderListingService.listChildren(folderId);
            Map<String, String> byName = new LinkedHashMap<>();
            for (StoreItem child : children) {
                if (child.isFolder() && !child.isTrashed() && StringUtils.isNotBlank(child.getName())) {
                    byName.putIfAbsent(child.getName().trim(), child.getId());
                }
            }
            this.childFolderCache.put(folderId, byName);
            return byName;
        }
    }
}
