package com.sparta.reward.domain.gacha.exception;

import com.sparta.reward.common.exception.BusinessException;
import com.sparta.reward.common.exception.ErrorCode;

/**
 * 가챠 캠페인을 찾을 수 없을 때 발생하는 예외
 */
public class GachaCampaignNotFoundException extends BusinessException {
    public GachaCampaignNotFoundException(String campaignKey) {
        super(ErrorCode.G001, "가챠 캠페인을 찾을 수 없습니다: " + campaignKey);
    }
}
