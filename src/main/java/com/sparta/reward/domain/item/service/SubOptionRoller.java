package com.sparta.reward.domain.item.service;

import com.sparta.reward.domain.item.entity.ItemType;
import com.sparta.reward.domain.item.entity.SubOptionDefinition;
import com.sparta.reward.domain.item.repository.SubOptionDefinitionRepository;
import com.sparta.reward.domain.item.vo.SubOption;
import com.sparta.reward.domain.reward.exception.RewardConfigurationException;
import com.sparta.reward.domain.reward.service.WeightedSelector;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 장비 서브 옵션 생성기
 * 옵션 풀에서 가중치 추첨으로 subOptionCount 개를 뽑고 값은 [min, max] 균등 분포
 */
@Component
@RequiredArgsConstructor
public class SubOptionRoller {

    private final SubOptionDefinitionRepository subOptionDefinitionRepository;
    private final WeightedSelector weightedSelector;
    private final Random random;

    public List<SubOption> roll(ItemType itemType) {
        if (!itemType.isEquipment() || itemType.getSubOptionCount() <= 0) {
            return List.of();
        }

        List<SubOptionDefinition> pool = subOptionDefinitionRepository.findByPoolKey(itemType.getSubOptionPoolKey());
        int totalWeight = pool.stream().mapToInt(SubOptionDefinition::getWeight).sum();

        List<SubOption> options = new ArrayList<>(itemType.getSubOptionCount());
        for (int i = 0; i < itemType.getSubOptionCount(); i++) {
            SubOptionDefinition definition = weightedSelector.pick(pool, SubOptionDefinition::getWeight, totalWeight)
                    .orElseThrow(() -> new RewardConfigurationException(
                            "서브 옵션 풀이 비어 있습니다: " + itemType.getSubOptionPoolKey()));
            options.add(new SubOption(definition.getOptionKey(), rollValue(definition)));
        }
        return options;
    }

    private int rollValue(SubOptionDefinition definition) {
        int min = definition.getMinValue();
        int max = Math.max(min, definition.getMaxValue());
        return min + random.nextInt(max - min + 1);
    }
}
