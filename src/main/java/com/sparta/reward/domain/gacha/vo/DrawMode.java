package com.sparta.reward.domain.gacha.vo;

/**
 * 뽑기 1회의 추첨 방식
 */
public enum DrawMode {
    RANDOM,
    NORMAL_GUARANTEE,
    SPECIAL_GUARANTEE
}
