package com.newsharvest.core.crawler;

/**
 * 약한 근거: 이번 페이지가 템플릿 기준 한 페이지 분량(nominalPerPage 이상)을 채웠고
 * 페이지 상한 전이면 더 있다고 본다.
 */
public final class FullPageSignal implements NextPageSignal {

    private final int nominalPerPage;

    public FullPageSignal(int nominalPerPage) {
        if (nominalPerPage < 1) throw new IllegalArgumentException("nominalPerPage must be >= 1");
        this.nominalPerPage = nominalPerPage;
    }

    @Override public String name() { return "full-page"; }

    @Override
    public boolean hasNext(PageContext ctx) {
        return ctx.newResults() >= nominalPerPage && ctx.pageNum() < ctx.maxPages();
    }
}
