package com.pipedesk.drive.service.hierarchy;

import com.pipedesk.drive.enums.EntityTypeEnum;
import com.pipedesk.drive.exception.StoreUnavailableException;
import com.pipedesk.drive.model.entity.FolderMappingEntity;
import com.pipedesk.drive.model.entity.FolderTemplateEntity;
import com.pipedesk.drive.model.internal.TemplateNodeDefinition;
import com.pipedesk.drive.model.store.StoreItem;
import com.pipedesk.drive.service.cache.FolderListingService;
import com.pipedesk.drive.service.db.impl.FolderTemplateService;
import com.pipedesk.drive.support.DriveTestBase;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TemplateMaterializerServiceTest extends DriveTestBase {

    @Autowired
    private TemplateMaterializerService templateMaterializerService;

    @Autowired
    private HierarchyService hierarchyService;

    @Autowired
    private FolderTemplateService folderTemplateService;

    @Autowired
    private FolderListingService folderListingService;

    @Test
    void ShouldCreateNothingWhenTemplateAppliedAgain() {
        StoreItem target = this.inMemoryFolderStoreClient.createFolder("target", ROOT_FOLDER_ID);

        assertEquals(9, this.templateMaterializerService.applyTemplate(EntityTypeEnum.DEAL, target.getId(), false));
        assertEquals(0, this.templateMaterializerService.applyTemplate(EntityTypeEnum.DEAL, target.getId(), false));
        assertEquals(0, this.templateMaterializerService.applyTemplate(EntityTypeEnum.DEAL, target.getId(), true));

        assertEquals(DefaultTemplateSeedService.DEAL_NODES, childNamesOf(target.getId()));
    }

    @Test
    void ShouldResumeWhenEarlierRunFailedHalfway() {
        StoreItem target = this.inMemoryFolderStoreClient.createFolder("target", ROOT_FOLDER_ID);
        this.flakyFolderStoreClient.failCreateFolderAt(5);

        assertThrows(StoreUnavailableException.class,
                () -> this.templateMaterializerService.applyTemplate(EntityTypeEnum.DEAL, target.getId(), false));
        assertEquals(DefaultTemplateSeedService.DEAL_NODES.subList(0, 4), childNamesOf(target.getId()));

        assertEquals(5, this.templateMaterializerService.applyTemplate(EntityTypeEnum.DEAL, target.getId(), false));
        List<String> names = childNamesOf(target.getId());
        assertEquals(9, names.size());
        assertEquals(9, new HashSet<>(names).size());
    }

    @Test
    void ShouldRecreateOnlyDeletedFolderWhenRepairing() {
        givenCompany("C1", "Acme");
        givenDeal("D1", "Torre Sul", "C1");
        FolderMappingEntity mapping = this.hierarchyService.ensureStructure(EntityTypeEnum.DEAL, "D1");
        // warm the listing cache so only a fresh read can see the deletion
        this.folderListingService.listChildren(mapping.getExternalFolderId());
        StoreItem commercial = onlyChildNamed(mapping.getExternalFolderId(), "04. Comercial");
        this.inMemoryFolderStoreClient.removeItem(commercial.getId());
        int before = this.flakyFolderStoreClient.getCreateFolderCalls();

        assertTrue(this.hierarchyService.repairStructure(EntityTypeEnum.DEAL, "D1"));

        assertEquals(before + 1, this.flakyFolderStoreClient.getCreateFolderCalls());
        List<String> names = childNamesOf(mapping.getExternalFolderId());
        assertEquals(9, names.size());
        assertEquals(9, new HashSet<>(names).size());
        assertNotEquals(commercial.getId(), onlyChildNamed(mapping.getExternalFolderId(), "04. Comercial").getId());

        assertTrue(this.hierarchyService.repairStructure(EntityTypeEnum.DEAL, "D1"));
        assertEquals(before + 1, this.flakyFolderStoreClient.getCreateFolderCalls());
    }

    @Test
    void ShouldFollowNestingAndSiblingOrder() {
        FolderTemplateEntity defaultLead =
                this.folderTemplateService.getByTemplateName(DefaultTemplateSeedService.LEAD_TEMPLATE_NAME);
        this.folderTemplateService.setActive(defaultLead.getTemplateId(), false);
        this.folderTemplateService.createTemplate(
                "nested-" + UUID.randomUUID(),
                EntityTypeEnum.LEAD,
                true,
                List.of(
                        TemplateNodeDefinition.of("B. Second",
                                TemplateNodeDefinition.of("B1"),
                                TemplateNodeDefinition.of("B2",
                                        TemplateNodeDefinition.of("B2a"))),
                        TemplateNodeDefinition.of("A. First")));
        StoreItem target = this.inMemoryFolderStoreClient.createFolder("target", ROOT_FOLDER_ID);

        assertEquals(5, this.templateMaterializerService.applyTemplate(EntityTypeEnum.LEAD, target.getId(), false));

        // declaration order, not alphabetical
        assertEquals(List.of("B. Second", "A. First"), childNamesOf(target.getId()));
        StoreItem second = onlyChildNamed(target.getId(), "B. Second");
        assertEquals(List.of("B1", "B2"), childNamesOf(second.getId()));
        StoreItem b2 = onlyChildNamed(second.getId(), "B2");
        assertEquals(List.of("B2a"), childNamesOf(b2.getId()));
        assertTrue(childrenOf(onlyChildNamed(target.getId(), "A. First").getId()).isEmpty());
    }

    @Test
    void ShouldReuseFolderWithSameTrimmedName() {
        StoreItem target = this.inMemoryFolderStoreClient.createFolder("target", ROOT_FOLDER_ID);
        StoreItem existing = this.inMemoryFolderStoreClient.createFolder(" 04. Comercial ", target.getId());
        // a file with a node's name does not count as the node
        this.inMemoryFolderStoreClient.createFile("x".getBytes(), "05. Financeiro & Modelagem", null, target.getId());

        assertEquals(8, this.templateMaterializerService.applyTemplate(EntityTypeEnum.DEAL, target.getId(), false));
        assertEquals(10, childrenOf(target.getId()).size());
        assertTrue(childrenOf(target.getId()).stream().anyMatch(item -> item.getId().equals(existing.getId())));
    }

    @Test
    void ShouldDoNothingWhenNoActiveTemplate() {
        FolderTemplateEntity defaultLead =
                this.folderTemplateService.getByTemplateName(DefaultTemplateSeedService.LEAD_TEMPLATE_NAME);
        this.folderTemplateService.setActive(defaultLead.getTemplateId(), false);
        StoreItem target = this.inMemoryFolderStoreClient.createFolder("target", ROOT_FOLDER_ID);

        assertEquals(0, this.templateMaterializerService.applyTemplate(EntityTypeEnum.LEAD, target.getId(), false));
        assertTrue(childrenOf(target.getId()).isEmpty());
    }

    @Test
    void ShouldNotCreateBlindWhenListingFails() {
        StoreItem target = this.inMemoryFolderStoreClient.createFolder("target", ROOT_FOLDER_ID);
        this.flakyFolderStoreClient.setFailListing(true);

        assertThrows(StoreUnavailableException.class,
                () -> this.templateMaterializerService.applyTemplate(EntityTypeEnum.DEAL, target.getId(), true));
        assertEquals(0, this.flakyFolderStoreClient.getCreateFolderCalls());
        assertTrue(childrenOf(target.getId()).isEmpty());
    }

    @Test
    void ShouldRecreateTrashedTemplateFolderWhenRepairing() {
        givenCompany("C1", "Acme");
        givenDeal("D1", "Torre Sul", "C1");
        FolderMappingEntity mapping = this.hierarchyService.ensureStructure(EntityTypeEnum.DEAL, "D1");
        StoreItem commercial = onlyChildNamed(mapping.getExternalFolderId(), "04. Comercial");
        this.inMemoryFolderStoreClient.trashItem(commercial.getId());

        assertTrue(this.hierarchyService.repairStructure(EntityTypeEnum.DEAL, "D1"));

        StoreItem recreated = onlyChildNamed(mapping.getExternalFolderId(), "04. Comercial");
        assertNotEquals(commercial.getId(), recreated.getId());
        assertFalse(recreated.isTrashed());
        assertEquals(new HashSet<>(DefaultTemplateSeedService.DEAL_NODES),
                new HashSet<>(childNamesOf(mapping.getExternalFolderId())));
        assertEquals(9, childNamesOf(mapping.getExternalFolderId()).size());
    }

    @Test
    void ShouldNotReuseTrashedFolderFromListing() {
        StoreItem target = this.inMemoryFolderStoreClient.createFolder("target", ROOT_FOLDER_ID);
        assertEquals(9, this.templateMaterializerService.applyTemplate(EntityTypeEnum.DEAL, target.getId(), false));
        StoreItem commercial = onlyChildNamed(target.getId(), "04. Comercial");
        this.inMemoryFolderStoreClient.trashItem(commercial.getId());
        // a listing that still reports the trashed folder, flagged
        List<StoreItem> listing = new ArrayList<>(childrenOf(target.getId()));
        listing.add(commercial.toBuilder().trashed(true).build());
        this.jsonCacheService.set(FolderListingService.listFilesKey(target.getId()), listing);

        assertEquals(1, this.templateMaterializerService.applyTemplate(EntityTypeEnum.DEAL, target.getId(), false));
        assertNotEquals(commercial.getId(), onlyChildNamed(target.getId(), "04. Comercial").getId());
    }

    @Test
    void ShouldCreateNoDuplicatesWhenCachedListingUnreadable() {
        StoreItem target = this.inMemoryFolderStoreClient.createFolder("target", ROOT_FOLDER_ID);
        assertEquals(9, this.templateMaterializerService.applyTemplate(EntityTypeEnum.DEAL, target.getId(), false));
        this.jsonCacheService.set(FolderListingService.listFilesKey(target.getId()), "not a listing");
        int listingsBefore = this.flakyFolderStoreClient.getListChildrenCalls();

        assertEquals(0, this.templateMaterializerService.applyTemplate(EntityTypeEnum.DEAL, target.getId(), false));

        assertTrue(this.flakyFolderStoreClient.getListChildrenCalls() > listingsBefore);
        assertEquals(DefaultTemplateSeedService.DEAL_NODES, childNamesOf(target.getId()));
    }
}
