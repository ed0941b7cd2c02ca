package com.sparta.reward.application.reward;

import com.sparta.reward.common.exception.BusinessException;
import com.sparta.reward.domain.currency.exception.InsufficientCurrencyException;
import com.sparta.reward.domain.gacha.repository.PityCounterRepository;
import com.sparta.reward.domain.gacha.vo.PitySession;
import com.sparta.reward.domain.gacha.vo.PityState;
import com.sparta.reward.domain.item.exception.InventoryFullException;
import com.sparta.reward.domain.item.service.InventorySimulator;
import com.sparta.reward.domain.item.service.SimulationResult;
import com.sparta.reward.domain.item.vo.StagedItemChange;
import com.sparta.reward.domain.reward.RewardType;
import com.sparta.reward.domain.reward.exception.RewardSimulationFailedException;
import com.sparta.reward.domain.reward.service.ResolutionBatch;
import com.sparta.reward.domain.reward.service.RewardGrantRegistry;
import com.sparta.reward.domain.reward.service.RewardResolver;
import com.sparta.reward.domain.reward.vo.RewardHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 보상 지급 트랜잭션 처리 서비스
 *
 * 처리 순서:
 * 1. 요청 전개 (가챠 추첨, 보상 테이블 전개)
 * 2. 시뮬레이션 (병합, 지급 검증, 인벤토리 용량 검증)
 * 3. 지급 적용
 * 4. 천장 카운터 저장
 *
 * 2단계에서 실패하면 어떤 상태도 변경되지 않는다.
 * 3단계 이후의 실패는 트랜잭션 롤백으로 함께 되돌려진다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RewardGrantService {

    private final RewardResolver rewardResolver;
    private final InventorySimulator inventorySimulator;
    private final RewardGrantRegistry rewardGrantRegistry;
    private final PityCounterRepository pityCounterRepository;

    @Transactional
    public RewardGrantResult grant(String accountId, List<RewardHandler> requests) {
        return grant(accountId, requests, List.of());
    }

    /**
     * @param stagedChanges 같은 트랜잭션에서 이후 적용될 아이템 변경 (슬롯 예측에만 반영)
     */
    @Transactional
    public RewardGrantResult grant(String accountId, List<RewardHandler> requests, List<StagedItemChange> stagedChanges) {
        ResolutionBatch batch = rewardResolver.resolve(accountId, requests);

        SimulationResult simulation = inventorySimulator.simulate(accountId, batch.rewards(), stagedChanges, true);
        if (!simulation.isSuccess()) {
            throw toException(simulation);
        }

        rewardGrantRegistry.applyAll(accountId, simulation.mergedRewards());
        Map<String, PityState> pityStates = savePityCounters(batch);

        log.info("보상 지급 완료 - accountId={}, 요청={}건, 지급={}건, 예상 슬롯={}/{}",
                accountId, requests.size(), simulation.mergedRewards().size(),
                simulation.predictedSlots(), simulation.maxCapacity());

        return new RewardGrantResult(simulation.mergedRewards(), batch.draws(), pityStates);
    }

    private Map<String, PityState> savePityCounters(ResolutionBatch batch) {
        Map<String, PityState> states = new LinkedHashMap<>();
        for (Map.Entry<String, PitySession> entry : batch.pitySessions().entrySet()) {
            PitySession session = entry.getValue();
            pityCounterRepository.save(session.flush());
            states.put(entry.getKey(), session.state());
            log.debug("천장 카운터 저장 - rewardKey={}, normal={}, special={}",
                    entry.getKey(), session.state().getNormal(), session.state().getSpecial());
        }
        return states;
    }

    private BusinessException toException(SimulationResult simulation) {
        RewardHandler failed = simulation.failedReward();
        if (simulation.failure() == SimulationResult.Failure.INVENTORY_FULL) {
            return new InventoryFullException(simulation.predictedSlots(), simulation.maxCapacity());
        }
        if (failed != null && failed.rewardType() == RewardType.CURRENCY) {
            return new InsufficientCurrencyException(failed.typeKey());
        }
        return new RewardSimulationFailedException(failed);
    }
}
