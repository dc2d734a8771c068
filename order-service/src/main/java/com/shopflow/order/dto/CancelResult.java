package com.shopflow.order.dto;

/**
 * 취소 결과. 이미 종료된 주문의 취소는 오류가 아니라 ok=false + "already &lt;status&gt;"
 */
public record CancelResult(boolean ok, String message) {

    public static CancelResult cancelled() {
        return new CancelResult(true, "cancelled");
    }

    public static CancelResult already(String statusLabel) {
        return new CancelResult(false, "already " + statusLabel);
    }
}
