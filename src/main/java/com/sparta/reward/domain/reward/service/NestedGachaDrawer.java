package com.sparta.reward.domain.reward.service;

import com.sparta.reward.domain.reward.vo.RewardHandler;

import java.util.List;

/**
 * 보상 테이블 안에 들어 있는 GACHA 보상의 추첨기
 *
 * 천장 상태는 배치 단위로 관리되므로 RewardResolver가 배치마다 구현을 넘긴다.
 * 반환값은 전개 전의 추첨 결과이며, 이후 전개는 RewardExpander가 이어서 한다.
 */
@FunctionalInterface
public interface NestedGachaDrawer {

    List<RewardHandler> draw(RewardHandler gacha);
}
