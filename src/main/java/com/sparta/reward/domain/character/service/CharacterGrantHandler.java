package com.sparta.reward.domain.character.service;

import com.sparta.reward.domain.character.entity.AccountCharacter;
import com.sparta.reward.domain.character.repository.AccountCharacterRepository;
import com.sparta.reward.domain.reward.RewardType;
import com.sparta.reward.domain.reward.service.RewardGrantHandler;
import com.sparta.reward.domain.reward.vo.RewardHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 플레이어 캐릭터 보상 지급 처리기
 * 이미 보유한 캐릭터는 중복 생성하지 않는다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CharacterGrantHandler implements RewardGrantHandler {

    private final AccountCharacterRepository accountCharacterRepository;

    @Override
    public RewardType supportedType() {
        return RewardType.PLAYER_CHARACTER;
    }

    @Override
    public boolean simulate(String accountId, RewardHandler reward) {
        // 캐릭터 회수는 지원하지 않음
        return reward.amount() > 0 && reward.typeKey() != null;
    }

    @Override
    public void apply(String accountId, RewardHandler reward) {
        if (accountCharacterRepository.existsByAccountIdAndCharacterKey(accountId, reward.typeKey())) {
            log.info("이미 보유한 캐릭터 - accountId={}, characterKey={}", accountId, reward.typeKey());
            return;
        }
        accountCharacterRepository.save(AccountCharacter.acquire(accountId, reward.typeKey()));
    }
}
