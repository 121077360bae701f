package com.pipedesk.drive.support;

import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.pipedesk.drive.mapper.CompanyMapper;
import com.pipedesk.drive.mapper.DealMapper;
import com.pipedesk.drive.mapper.FileMappingMapper;
import com.pipedesk.drive.mapper.FolderMappingMapper;
import com.pipedesk.drive.mapper.FolderTemplateMapper;
import com.pipedesk.drive.mapper.LeadMapper;
import com.pipedesk.drive.model.entity.CompanyEntity;
import com.pipedesk.drive.model.entity.DealEntity;
import com.pipedesk.drive.model.entity.FolderTemplateEntity;
import com.pipedesk.drive.model.entity.LeadEntity;
import com.pipedesk.drive.model.store.StoreItem;
import com.pipedesk.drive.service.cache.JsonCacheService;
import com.pipedesk.drive.service.hierarchy.DefaultTemplateSeedService;
import com.pipedesk.drive.service.store.InMemoryFolderStoreClient;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Shared context for the Spring tests: H2, the in-memory store behind {@link FlakyFolderStoreClient},
 * and the default templates as the only active ones. Every test starts from empty mapping and CRM
 * tables and an empty store.
 */
@SpringBootTest
@ActiveProfiles("test")
@TestPropertySource(properties = "spring.profiles.active=test")
@Import(StoreTestConfig.class)
public abstract class DriveTestBase {

    protected static final String ROOT_FOLDER_ID = "root";

    private static final Set<String> DEFAULT_TEMPLATE_NAMES = Set.of(
            DefaultTemplateSeedService.COMPANY_TEMPLATE_NAME,
            DefaultTemplateSeedService.LEAD_TEMPLATE_NAME,
            DefaultTemplateSeedService.DEAL_TEMPLATE_NAME);

    @Autowired
    protected InMemoryFolderStoreClient inMemoryFolderStoreClient;

    @Autowired
    protected FlakyFolderStoreClient flakyFolderStoreClient;

    @Autowired
    protected JsonCacheService jsonCacheService;

    @Autowired
    protected CompanyMapper companyMapper;

    @Autowired
    protected LeadMapper leadMapper;

    @Autowired
    protected DealMapper dealMapper;

    @Autowired
    protected FolderMappingMapper folderMappingMapper;

    @Autowired
    protected FileMappingMapper fileMappingMapper;

    @Autowired
    protected FolderTemplateMapper folderTemplateMapper;

    @BeforeEach
    void resetState() {
        this.folderMappingMapper.delete(new QueryWrapper<>());
        this.fileMappingMapper.delete(new QueryWrapper<>());
        this.companyMapper.delete(new QueryWrapper<>());
        this.leadMapper.delete(new QueryWrapper<>());
        this.dealMapper.delete(new QueryWrapper<>());
        // templates stay, only the defaults are active
        LambdaUpdateWrapper<FolderTemplateEntity> deactivate = new LambdaUpdateWrapper<>();
        deactivate.notIn(FolderTemplateEntity::getTemplateName, DEFAULT_TEMPLATE_NAMES);
        deactivate.set(FolderTemplateEntity::getActive, false);
        this.folderTemplateMapper.update(null, deactivate);
        LambdaUpdateWrapper<FolderTemplateEntity> activate = new LambdaUpdateWrapper<>();
        activate.in(FolderTemplateEntity::getTemplateName, DEFAULT_TEMPLATE_NAMES);
        activate.set(FolderTemplateEntity::getActive, true);
        this.folderTemplateMapper.update(null, activate);

        this.inMemoryFolderStoreClient.reset();
        this.jsonCacheService.flushAll();
        this.jsonCacheService.setEnabled(true);
        this.flakyFolderStoreClient.reset();
    }

    protected CompanyEntity givenCompany(String companyId, String companyName) {
        CompanyEntity company = new CompanyEntity();
        company.setCompanyId(companyId);
        company.setCompanyName(companyName);
        this.companyMapper.insert(company);
        return company;
    }

    protected LeadEntity givenLead(String leadId, String legalName, String companyId) {
        LeadEntity lead = new LeadEntity();
        lead.setLeadId(leadId);
        lead.setLegalName(legalName);
        lead.setCompanyId(companyId);
        this.leadMapper.insert(lead);
        return lead;
    }

    protected DealEntity givenDeal(String dealId, String title, String companyId) {
        DealEntity deal = new DealEntity();
        deal.setDealId(dealId);
        deal.setTitle(title);
        deal.setCompanyId(companyId);
        this.dealMapper.insert(deal);
        return deal;
    }

    protected List<StoreItem> childrenOf(String folderId) {
        return this.inMemoryFolderStoreClient.listChildren(folderId);
    }

    protected List<String> childNamesOf(String folderId) {
        return this.childrenOf(folderId).stream().map(StoreItem::getName).collect(Collectors.toList());
    }

    protected StoreItem onlyChildNamed(String folderId, String name) {
        List<StoreItem> matches = this.childrenOf(folderId).stream()
                .filter(item -> name.equals(item.getName()))
                .toList();
        if (matches.size() != 1) {
            throw new AssertionError("expected exactly one '%s' under %s, found %s"
                    .formatted(name, folderId, matches.size()));
        }
        return matches.get(0);
    }
}
