package com.justtrades.mapper;

import com.justtrades.domain.model.DcaConfig;
import com.justtrades.domain.model.Position;
import com.justtrades.entity.PositionEntity;
import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between the Position domain model and PositionEntity.
 *
 * <p>Fired DCA rung indices are stored as a comma-separated string and the DCA
 * config as JSON. The entity id is the position key; {@code updatedAt} is set
 * by the ledger on save.
 */
@Mapper
public interface PositionMapper {

    @Mapping(target = "id", expression = "java(position.key().asId())")
    @Mapping(target = "updatedAt", ignore = true)
    @Mapping(target = "dcaTriggeredIndices", source = "dcaTriggeredIndices", qualifiedByName = "indicesToString")
    @Mapping(target = "dcaConfigJson", source = "dcaConfig", qualifiedByName = "dcaConfigToJson")
    PositionEntity toEntity(Position position);

    @Mapping(target = "dcaTriggeredIndices", source = "dcaTriggeredIndices", qualifiedByName = "stringToIndices")
    @Mapping(target = "dcaConfig", source = "dcaConfigJson", qualifiedByName = "jsonToDcaConfig")
    Position toDomain(PositionEntity entity);

    @Named("indicesToString")
    default String indicesToString(Set<Integer> indices) {
        if (indices == null || indices.isEmpty()) {
            return "";
        }
        return new TreeSet<>(indices).stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    @Named("stringToIndices")
    default Set<Integer> stringToIndices(String value) {
        Set<Integer> indices = new TreeSet<>();
        if (value == null || value.isBlank()) {
            return indices;
        }
        Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Integer::valueOf)
                .forEach(indices::add);
        return indices;
    }

    @Named("dcaConfigToJson")
    default String dcaConfigToJson(DcaConfig config) {
        return JsonHelper.toJson(config);
    }

    @Named("jsonToDcaConfig")
    default DcaConfig jsonToDcaConfig(String json) {
        return JsonHelper.fromJson(json, DcaConfig.class);
    }
}
