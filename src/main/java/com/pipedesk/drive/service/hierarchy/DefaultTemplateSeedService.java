package com.pipedesk.drive.service.hierarchy;

import com.pipedesk.drive.enums.EntityTypeEnum;
import com.pipedesk.drive.model.internal.TemplateNodeDefinition;
import com.pipedesk.drive.service.db.impl.FolderTemplateService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Stores the built-in company, lead and deal templates. Templates already present by name are left
 * as they are.
 */
@Slf4j
@Service
public class DefaultTemplateSeedService {

    public static final String COMPANY_TEMPLATE_NAME = "Default Company Template";

    public static final String LEAD_TEMPLATE_NAME = "Default Lead Template";

    public static final String DEAL_TEMPLATE_NAME = "Default Deal Template";

    static final List<String> COMPANY_NODES = List.of(
            "01. Leads",
            "02. Deals",
            "03. Documentos Gerais",
            "90. Compartilhamento Externo",
            "99. Arquivo / Encerrados");

    static final List<String> LEAD_NODES = List.of(
            "00. Administração do Lead",
            "01. Originação & Materiais",
            "02. Ativo / Terreno (Básico)",
            "03. Empreendimento & Viabilidade (Preliminar)",
            "04. Partes & KYC (Básico)",
            "05. Decisão Interna");

    static final List<String> DEAL_NODES = List.of(
            "00. Administração do Deal",
            "01. Originação & Mandato",
            "02. Ativo / Terreno & Garantias",
            "03. Empreendimento & Projeto",
            "04. Comercial",
            "05. Financeiro & Modelagem",
            "06. Partes & KYC",
            "07. Jurídico & Estruturação",
            "08. Operação & Monitoring");

    private final FolderTemplateService folderTemplateService;

    @Autowired
    public DefaultTemplateSeedService(FolderTemplateService folderTemplateService) {
        this.folderTemplateService = folderTemplateService;
    }

    /**
     * @return the number of templates created by this call
     */
    public int seedDefaults() {
        int created = 0;
        created += this.seed(COMPANY_TEMPLATE_NAME, EntityTypeEnum.COMPANY, COMPANY_NODES);
        created += this.seed(LEAD_TEMPLATE_NAME, EntityTypeEnum.LEAD, LEAD_NODES);
        created += this.seed(DEAL_TEMPLATE_NAME, EntityTypeEnum.DEAL, DEAL_NODES);
        return created;
    }

    private int seed(String templateName, EntityTypeEnum entityType, List<String> nodeNames) {
        if (ObjectUtils.isNotEmpty(this.folderTemplateService.getByTemplateName(templateName))) {
            log.debug("template '{}' already exists", templateName);
            return 0;
        }
        this.folderTemplateService.createTemplate(
                templateName, entityType, true, TemplateNodeDefinition.flat(nodeNames));
        return 1;
    }
}
