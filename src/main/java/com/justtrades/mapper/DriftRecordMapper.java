package com.justtrades.mapper;

import com.justtrades.domain.model.DriftRecord;
import com.justtrades.entity.DriftRecordEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface DriftRecordMapper {

    DriftRecordEntity toEntity(DriftRecord record);

    DriftRecord toDomain(DriftRecordEntity entity);

    List<DriftRecord> toDomainList(List<DriftRecordEntity> entities);
}
