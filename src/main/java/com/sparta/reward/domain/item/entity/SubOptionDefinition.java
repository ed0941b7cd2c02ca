package com.sparta.reward.domain.item.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장비 서브 옵션 풀 항목 (정적 설정 데이터)
 */
@Entity
@Table(name = "sub_option_definitions", indexes = {
        @Index(name = "idx_sub_option_definitions_pool", columnList = "pool_key")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class SubOptionDefinition {

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "pool_key", nullable = false)
    private String poolKey;

    @Column(name = "option_key", nullable = false)
    private String optionKey;

    @Column(name = "min_value", nullable = false)
    private int minValue;

    @Column(name = "max_value", nullable = false)
    private int maxValue;

    @Column(name = "weight", nullable = false)
    private int weight;
}
