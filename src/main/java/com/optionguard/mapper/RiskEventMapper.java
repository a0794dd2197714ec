package com.optionguard.mapper;

import com.optionguard.domain.model.RiskEvent;
import com.optionguard.entity.RiskEventEntity;
import com.optionguard.event.RiskComponent;
import com.optionguard.event.RiskEventType;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between the RiskEvent domain record and RiskEventEntity.
 *
 * <p>Event type and component go through their explicit wire values; metadata is a Map
 * in the domain and a JSON string in the entity.
 */
@Mapper
public interface RiskEventMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(source = "eventType", target = "eventType", qualifiedByName = "typeToWire")
    @Mapping(source = "component", target = "component", qualifiedByName = "componentToWire")
    @Mapping(source = "metadata", target = "metadata", qualifiedByName = "mapToJson")
    RiskEventEntity toEntity(RiskEvent riskEvent);

    @Mapping(source = "eventType", target = "eventType", qualifiedByName = "wireToType")
    @Mapping(source = "component", target = "component", qualifiedByName = "wireToComponent")
    @Mapping(source = "metadata", target = "metadata", qualifiedByName = "jsonToMap")
    RiskEvent toDomain(RiskEventEntity entity);

    List<RiskEventEntity> toEntityList(List<RiskEvent> events);

    List<RiskEvent> toDomainList(List<RiskEventEntity> entities);

    @Named("typeToWire")
    default String typeToWire(RiskEventType type) {
        return type != null ? type.getWireValue() : null;
    }

    @Named("wireToType")
    default RiskEventType wireToType(String wireValue) {
        return wireValue != null ? RiskEventType.fromWireValue(wireValue) : null;
    }

    @Named("componentToWire")
    default String componentToWire(RiskComponent component) {
        return component != null ? component.getWireValue() : null;
    }

    @Named("wireToComponent")
    default RiskComponent wireToComponent(String wireValue) {
        if (wireValue == null) {
            return null;
        }
        return Arrays.stream(RiskComponent.values())
                .filter(c -> c.getWireValue().equals(wireValue))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown risk component: " + wireValue));
    }

    @Named("mapToJson")
    default String mapToJson(Map<String, Object> metadata) {
        return JsonHelper.toJson(metadata);
    }

    @Named("jsonToMap")
    default Map<String, Object> jsonToMap(String json) {
        return JsonHelper.toMap(json);
    }
}
