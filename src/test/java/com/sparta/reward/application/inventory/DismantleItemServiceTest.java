package com.sparta.reward.application.inventory;

import com.sparta.reward.application.inventory.dto.DismantleItemResponse;
import com.sparta.reward.application.inventory.service.DismantleItemService;
import com.sparta.reward.application.reward.RewardGrantResult;
import com.sparta.reward.application.reward.RewardGrantService;
import com.sparta.reward.domain.item.entity.InventoryItem;
import com.sparta.reward.domain.item.entity.ItemType;
import com.sparta.reward.domain.item.exception.InventoryFullException;
import com.sparta.reward.domain.item.exception.InventoryItemNotFoundException;
import com.sparta.reward.domain.item.repository.InventoryItemRepository;
import com.sparta.reward.domain.item.repository.ItemTypeRepository;
import com.sparta.reward.domain.item.service.InventoryApplier;
import com.sparta.reward.domain.item.vo.StagedItemChange;
import com.sparta.reward.domain.reward.exception.RewardConfigurationException;
import com.sparta.reward.domain.reward.vo.RewardHandler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * 아이템 분해 서비스 테스트
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("아이템 분해 서비스 테스트")
class DismantleItemServiceTest {

    private static final String ACCOUNT_ID = "A001";

    private static final ItemType SWORD = ItemType.builder()
            .itemTypeKey("SWORD").maxStack(1).requiresSlot(true).equipment(true)
            .dismantleRewardKey("DISMANTLE_SWORD").build();

    @Mock
    private InventoryItemRepository inventoryItemRepository;

    @Mock
    private ItemTypeRepository itemTypeRepository;

    @Mock
    private InventoryApplier inventoryApplier;

    @Mock
    private RewardGrantService rewardGrantService;

    @InjectMocks
    private DismantleItemService dismantleItemService;

    private InventoryItem sword() {
        return InventoryItem.builder()
                .itemUid("UID-SWORD").accountId(ACCOUNT_ID).itemTypeKey("SWORD").amount(1).build();
    }

    @Test
    @DisplayName("분해 보상을 레코드 제거 예정과 함께 지급한 뒤 레코드를 제거한다")
    void 분해_성공() {
        // given
        InventoryItem sword = sword();
        given(inventoryItemRepository.findById("UID-SWORD")).willReturn(Optional.of(sword));
        given(itemTypeRepository.findById("SWORD")).willReturn(Optional.of(SWORD));
        given(rewardGrantService.grant(
                ACCOUNT_ID,
                List.of(RewardHandler.rewardData("DISMANTLE_SWORD", 1)),
                List.of(new StagedItemChange("SWORD", -1, StagedItemChange.ChangeKind.DELETED))
        )).willReturn(new RewardGrantResult(List.of(RewardHandler.item("IRON", 3)), List.of(), Map.of()));
        given(inventoryApplier.removeItem(sword, 1)).willReturn(true);

        // when
        DismantleItemResponse response = dismantleItemService.dismantle(ACCOUNT_ID, "UID-SWORD");

        // then
        assertThat(response.itemUid()).isEqualTo("UID-SWORD");
        assertThat(response.dismantledAmount()).isEqualTo(1);
        assertThat(response.rewards()).hasSize(1);
        assertThat(response.rewards().get(0).typeKey()).isEqualTo("IRON");
        verify(inventoryApplier).removeItem(sword, 1);
    }

    @Test
    @DisplayName("다른 계정의 아이템은 찾을 수 없다")
    void 타계정_아이템() {
        // given
        given(inventoryItemRepository.findById("UID-SWORD")).willReturn(Optional.of(sword()));

        // when & then
        assertThatThrownBy(() -> dismantleItemService.dismantle("A999", "UID-SWORD"))
                .isInstanceOf(InventoryItemNotFoundException.class);
    }

    @Test
    @DisplayName("분해 보상이 없는 아이템은 분해할 수 없다")
    void 분해불가_아이템() {
        // given
        InventoryItem potion = InventoryItem.builder()
                .itemUid("UID-POTION").accountId(ACCOUNT_ID).itemTypeKey("POTION").amount(5).build();
        given(inventoryItemRepository.findById("UID-POTION")).willReturn(Optional.of(potion));
        given(itemTypeRepository.findById("POTION"))
                .willReturn(Optional.of(ItemType.builder().itemTypeKey("POTION").maxStack(99).build()));

        // when & then
        assertThatThrownBy(() -> dismantleItemService.dismantle(ACCOUNT_ID, "UID-POTION"))
                .isInstanceOf(RewardConfigurationException.class);
        verify(rewardGrantService, never()).grant(any(), any(), any());
    }

    @Test
    @DisplayName("분해 보상 지급이 실패하면 아이템을 제거하지 않는다")
    void 지급실패_제거안함() {
        // given
        InventoryItem sword = sword();
        given(inventoryItemRepository.findById("UID-SWORD")).willReturn(Optional.of(sword));
        given(itemTypeRepository.findById("SWORD")).willReturn(Optional.of(SWORD));
        given(rewardGrantService.grant(any(), any(), any())).willThrow(new InventoryFullException(11, 10));

        // when & then
        assertThatThrownBy(() -> dismantleItemService.dismantle(ACCOUNT_ID, "UID-SWORD"))
                .isInstanceOf(InventoryFullException.class);
        verify(inventoryApplier, never()).removeItem(any(), anyInt());
    }
}
