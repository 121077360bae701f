package com.pipedesk.drive.configuration;


import com.pipedesk.drive.service.hierarchy.DefaultTemplateSeedService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

@Configuration
@Slf4j
public class ApplicationLifeCycleConfig {

    @Value("${spring.profiles.active:prod}")
    private String activeProfile;

    @Value("${pipedesk.drive.template.seed-defaults:true}")
    private boolean seedDefaultTemplates;

    private final DefaultTemplateSeedService defaultTemplateSeedService;

    @Autowired
    public ApplicationLifeCycleConfig(DefaultTemplateSeedService defaultTemplateSeedService) {
        this.defaultTemplateSeedService = defaultTemplateSeedService;
    }

    // after sql init, the template tables must exist
    @EventListener(ApplicationReadyEvent.class)
    public void startUp() {
        log.info("Starting up {} environment", this.activeProfile);
        if (this.seedDefaultTemplates) {
            int created = this.defaultTemplateSeedService.seedDefaults();
            log.info("default templates seeded. {} created", created);
        }
    }
}
