package com.justtrades.mapper;

import com.justtrades.domain.model.PositionAuditEntry;
import com.justtrades.entity.PositionAuditEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface PositionAuditMapper {

    PositionAuditEntity toEntity(PositionAuditEntry entry);

    PositionAuditEntry toDomain(PositionAuditEntity entity);

    List<PositionAuditEntry> toDomainList(List<PositionAuditEntity> entities);
}
