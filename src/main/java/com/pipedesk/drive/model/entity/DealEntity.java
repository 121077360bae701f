package com.pipedesk.drive.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("crm_deal")
public class DealEntity {

    @TableId(type = IdType.INPUT)
    private String dealId;

    private String title;

    private String companyId;

    private LocalDateTime deletedAt;
}
