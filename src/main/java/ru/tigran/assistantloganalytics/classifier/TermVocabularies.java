package ru.tigran.assistantloganalytics.classifier;

import java.util.List;

/**
 * Fixed vocabularies for multi-label term counting. Order matters: it breaks count ties.
 */
public final class TermVocabularies {

    /**
     * Metals and related commodities covered by the market data business.
     */
    public static final List<String> METALS = List.of(
            "铜", "铝", "锌", "铅", "镍", "锡",
            "锂", "钴", "不锈钢", "金", "银",
            "稀土", "钨", "钼", "硅", "镁", "锰",
            "钛", "铬", "铟", "镓", "锗", "铼",
            "钒", "锆", "铪", "钽", "铌", "铂",
            "钯", "铑", "铱", "钌", "锇",
            "碳酸锂", "氢氧化锂", "磷酸铁锂", "六氟磷酸锂", "电解液",
            "三元", "光伏", "多晶硅", "硅片", "电池", "组件", "EVA", "POE",
            "废钢", "废铜", "废铝", "石油焦", "阳极", "黑粉", "碳酸酯", "氧化铝"
    );

    /**
     * Business-intent phrases. Metal names are left out since they have their own chart.
     */
    public static final List<String> KEYWORDS = List.of(
            "价格", "库存", "走势", "涨", "跌", "预测",
            "结算", "加工费", "升贴水", "现货", "期货",
            "产量", "消费", "废", "再生", "月度", "年度",
            "成本", "利润", "供需", "产能", "开工率",
            "报价", "均价", "指数", "进口", "出口",
            "政策", "宏观", "美联储", "降息", "汇率",
            "行情", "分析", "数据", "报表", "日报", "周报",
            "多少钱", "LME", "SHFE", "长江", "SMM", "排产", "销量"
    );

    private TermVocabularies() {
    }
}
