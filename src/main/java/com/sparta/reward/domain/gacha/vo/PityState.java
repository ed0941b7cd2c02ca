package com.sparta.reward.domain.gacha.vo;

import com.sparta.reward.domain.gacha.entity.GachaCampaign;
import lombok.Getter;

/**
 * 뽑기 배치 동안 메모리에서만 변경되는 천장 카운터 상태
 * 배치가 끝나면 PityCounter에 한 번만 반영된다
 */
@Getter
public class PityState {

    private int normal;
    private int special;

    public PityState(int normal, int special) {
        if (normal < 0 || special < 0) {
            throw new IllegalArgumentException("천장 카운터는 음수일 수 없습니다");
        }
        this.normal = normal;
        this.special = special;
    }

    /**
     * 뽑기 1회 시작 (결과 판정 전에 두 카운터 모두 증가)
     */
    public void increment() {
        normal++;
        special++;
    }

    /**
     * 이번 뽑기의 추첨 방식 결정 (천장 > 일반 천장 > 일반 추첨 순)
     */
    public DrawMode decideMode(GachaCampaign campaign) {
        if (campaign.hasSpecialGuarantee() && special >= campaign.getSpecialTryCount()) {
            return DrawMode.SPECIAL_GUARANTEE;
        }
        if (campaign.hasNormalGuarantee() && normal >= GachaCampaign.NORMAL_TRY_COUNT) {
            return DrawMode.NORMAL_GUARANTEE;
        }
        return DrawMode.RANDOM;
    }

    /**
     * 보장 추첨 후 카운터 리셋
     */
    public void onGuaranteed(DrawMode mode) {
        if (mode == DrawMode.SPECIAL_GUARANTEE) {
            resetAll();
        } else if (mode == DrawMode.NORMAL_GUARANTEE) {
            normal = 0;
        }
    }

    /**
     * 일반 추첨에서 높은 등급을 얻으면 보장 추첨과 동일하게 카운터를 소모한다
     *
     * 보장 활성 여부와 무관하게 등급만 비교한다.
     * 픽업 그룹이 0인 캠페인은 모든 추첨에서 해당 카운터가 리셋된다.
     */
    public void onRandomDraw(int pickupGroup, GachaCampaign campaign) {
        if (pickupGroup >= campaign.getSpecialPickupGroup()) {
            resetAll();
        } else if (pickupGroup >= campaign.getNormalPickupGroup()) {
            normal = 0;
        }
    }

    public int remainingToNormal() {
        return Math.max(0, GachaCampaign.NORMAL_TRY_COUNT - normal);
    }

    public int remainingToSpecial(GachaCampaign campaign) {
        return Math.max(0, campaign.getSpecialTryCount() - special);
    }

    private void resetAll() {
        normal = 0;
        special = 0;
    }
}
